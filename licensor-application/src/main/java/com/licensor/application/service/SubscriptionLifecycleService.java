package com.licensor.application.service;

import com.licensor.application.ports.LicenseRepository;
import com.licensor.application.ports.RepositoryException;
import com.licensor.application.ports.UnitOfWork;
import com.licensor.domain.device.Device;
import com.licensor.domain.device.DeviceNotFoundException;
import com.licensor.domain.license.LicenseKeyCodec;
import com.licensor.domain.subscription.Subscription;
import com.licensor.domain.subscription.SubscriptionNotFoundException;
import com.licensor.domain.subscription.SubscriptionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.BiConsumer;

/**
 * Operator-side subscription management.
 * Each call is one unit of work; unknown ids raise {@link SubscriptionNotFoundException}.
 */
public class SubscriptionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionLifecycleService.class);

    static final int MAX_KEY_ATTEMPTS = 5;

    private final LicenseRepository repository;
    private final UnitOfWork unitOfWork;
    private final LicenseKeyCodec keyCodec;
    private final Clock clock;
    private final int defaultGracePeriodDays;

    public SubscriptionLifecycleService(LicenseRepository repository,
                                        UnitOfWork unitOfWork,
                                        LicenseKeyCodec keyCodec,
                                        Clock clock,
                                        int defaultGracePeriodDays) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.keyCodec = Objects.requireNonNull(keyCodec, "keyCodec");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (defaultGracePeriodDays < 0) {
            throw new IllegalArgumentException("defaultGracePeriodDays must be >= 0");
        }
        this.defaultGracePeriodDays = defaultGracePeriodDays;
    }

    public Subscription create(CreateSubscriptionCommand cmd) {
        Objects.requireNonNull(cmd, "cmd");
        Objects.requireNonNull(cmd.customerId(), "customerId");
        Objects.requireNonNull(cmd.tier(), "tier");
        if (cmd.durationDays() != null && cmd.durationDays() < 1) {
            throw new IllegalArgumentException("durationDays must be >= 1");
        }
        Instant now = clock.instant();
        int grace = cmd.gracePeriodDays() == null ? defaultGracePeriodDays : cmd.gracePeriodDays();
        Instant expiresAt = cmd.durationDays() == null ? null : now.plus(Duration.ofDays(cmd.durationDays()));

        Subscription created = unitOfWork.execute(() -> {
            String key = allocateLicenseKey();
            Subscription s = Subscription.create(cmd.customerId(), key, cmd.tier(), cmd.maxDevices(), grace,
                    cmd.featureOverrides(), now, expiresAt, now);
            s.activate(now);
            return repository.createSubscription(s);
        });

        log.info("Subscription created id={} customerId={} tier={} key={}",
                created.id(), created.customerId(), created.tier().wireName(), LicenseKeyCodec.mask(created.licenseKey()));
        return created;
    }

    public Subscription get(UUID subscriptionId) {
        return unitOfWork.execute(() -> load(subscriptionId));
    }

    public List<Subscription> listForCustomer(UUID customerId) {
        Objects.requireNonNull(customerId, "customerId");
        return unitOfWork.execute(() -> repository.findSubscriptionsByCustomerId(customerId));
    }

    public Subscription suspend(UUID subscriptionId) {
        return mutate(subscriptionId, "suspend", (s, now) -> s.suspend(now));
    }

    public Subscription cancel(UUID subscriptionId) {
        return mutateWithDevices(subscriptionId, "cancel", (s, now) -> s.cancel(now));
    }

    /**
     * Also allowed from CANCELLED. Only devices switched off by the cancellation come back.
     */
    public Subscription resume(UUID subscriptionId) {
        return mutateWithDevices(subscriptionId, "resume", (s, now) -> s.resume(now));
    }

    public Subscription extend(UUID subscriptionId, int days) {
        return mutate(subscriptionId, "extend", (s, now) -> s.extendExpiry(days, now));
    }

    public Subscription updateTier(UUID subscriptionId, SubscriptionTier tier, Map<String, ?> overrides) {
        return mutate(subscriptionId, "update_tier", (s, now) -> s.updateTier(tier, overrides, now));
    }

    public Subscription changeLimits(UUID subscriptionId, int maxDevices, int gracePeriodDays) {
        return mutate(subscriptionId, "change_limits", (s, now) -> s.changeLimits(maxDevices, gracePeriodDays, now));
    }

    /**
     * Operator-side deactivation of one device.
     *
     * @throws DeviceNotFoundException when no device with this client id is bound
     */
    public Subscription releaseDevice(UUID subscriptionId, String deviceId) {
        Instant now = clock.instant();
        Subscription s = unitOfWork.execute(() -> {
            Subscription loaded = load(subscriptionId);
            Device d = loaded.findDevice(deviceId).orElseThrow(() -> new DeviceNotFoundException(deviceId));
            loaded.removeDevice(deviceId, now);
            repository.updateDevice(d);
            repository.updateSubscription(loaded);
            return loaded;
        });
        log.info("Device released subscriptionId={} deviceId={}", subscriptionId, deviceId);
        return s;
    }

    private Subscription mutate(UUID subscriptionId, String operation, BiConsumer<Subscription, Instant> change) {
        Instant now = clock.instant();
        Subscription s = unitOfWork.execute(() -> {
            Subscription loaded = load(subscriptionId);
            change.accept(loaded, now);
            repository.updateSubscription(loaded);
            return loaded;
        });
        log.info("Subscription {} id={} status={}", operation, s.id(), s.status());
        return s;
    }

    private Subscription mutateWithDevices(UUID subscriptionId, String operation, BiConsumer<Subscription, Instant> change) {
        Instant now = clock.instant();
        Subscription s = unitOfWork.execute(() -> {
            Subscription loaded = load(subscriptionId);
            change.accept(loaded, now);
            repository.updateSubscription(loaded);
            for (Device d : loaded.devices()) {
                repository.updateDevice(d);
            }
            return loaded;
        });
        log.info("Subscription {} id={} status={} activeDevices={}", operation, s.id(), s.status(), s.activeDeviceCount());
        return s;
    }

    private Subscription load(UUID subscriptionId) {
        Objects.requireNonNull(subscriptionId, "subscriptionId");
        return repository.getSubscriptionById(subscriptionId)
                .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
    }

    private String allocateLicenseKey() {
        for (int attempt = 1; attempt <= MAX_KEY_ATTEMPTS; attempt++) {
            String key = keyCodec.generate();
            if (!repository.existsByLicenseKey(key)) {
                return key;
            }
            log.warn("License key collision on attempt {}", attempt);
        }
        throw new RepositoryException("Could not allocate a unique license key after " + MAX_KEY_ATTEMPTS + " attempts");
    }
}
