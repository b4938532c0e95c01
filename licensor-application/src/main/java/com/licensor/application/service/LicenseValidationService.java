package com.licensor.application.service;

import com.licensor.application.ports.LicenseClaims;
import com.licensor.application.ports.LicenseRepository;
import com.licensor.application.ports.LicenseTokenIssuer;
import com.licensor.application.ports.LicenseTokenIssuer.IssuedToken;
import com.licensor.application.ports.UnitOfWork;
import com.licensor.domain.device.Device;
import com.licensor.domain.device.DeviceInfo;
import com.licensor.domain.feature.FeatureSet;
import com.licensor.domain.license.LicenseKeyCodec;
import com.licensor.domain.license.LicenseKeyInvalidException;
import com.licensor.domain.subscription.Subscription;
import com.licensor.domain.subscription.SubscriptionExpiredException;
import com.licensor.domain.subscription.SubscriptionInactiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Client-facing license operations: activate, validate, deactivate, check a feature.
 *
 * Every operation reads and mutates one subscription inside a single unit of work.
 * Activation tokens are signed after the unit of work has committed, so a token is never
 * handed out for a device binding that was rolled back.
 */
public class LicenseValidationService {

    private static final Logger log = LoggerFactory.getLogger(LicenseValidationService.class);

    private final LicenseRepository repository;
    private final UnitOfWork unitOfWork;
    private final LicenseTokenIssuer tokenIssuer;
    private final LicenseKeyCodec keyCodec;
    private final Clock clock;

    public LicenseValidationService(LicenseRepository repository,
                                    UnitOfWork unitOfWork,
                                    LicenseTokenIssuer tokenIssuer,
                                    LicenseKeyCodec keyCodec,
                                    Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.tokenIssuer = Objects.requireNonNull(tokenIssuer, "tokenIssuer");
        this.keyCodec = Objects.requireNonNull(keyCodec, "keyCodec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Binds {@code deviceId} to the subscription behind {@code licenseKey} and signs a token for it.
     *
     * @throws LicenseKeyInvalidException     malformed or unknown key
     * @throws SubscriptionExpiredException   past expiry plus grace period
     * @throws SubscriptionInactiveException  not usable for any other reason (suspended, cancelled, not started)
     * @throws com.licensor.domain.device.DeviceLimitExceededException no free device slot
     */
    public ActivationResult activate(String licenseKey, String deviceId, DeviceInfo deviceInfo) {
        requireDeviceId(deviceId);
        requireWellFormed(licenseKey);
        Instant now = clock.instant();

        Activation activation = unitOfWork.execute(() -> {
            Subscription s = load(licenseKey);
            ensureUsable(s, now);

            Optional<Device> existing = s.findDevice(deviceId);
            if (existing.isPresent()) {
                Device d = existing.get();
                if (d.isActive()) {
                    return new Activation(s, ActivationAction.ALREADY_ACTIVE);
                }
                s.reactivateDevice(d, now);
                d.updateInfo(deviceInfo, now);
                d.touch(now);
                repository.updateDevice(d);
                repository.updateSubscription(s);
                return new Activation(s, ActivationAction.REACTIVATED);
            }

            Device d = Device.register(deviceId, deviceInfo, now);
            s.addDevice(d, now);
            repository.createDevice(d);
            repository.updateSubscription(s);
            return new Activation(s, ActivationAction.CAN_ACTIVATE);
        });

        Subscription s = activation.subscription();
        IssuedToken token = tokenIssuer.issue(LicenseClaims.of(s, deviceId));

        log.info("License activated subscriptionId={} deviceId={} action={} key={}",
                s.id(), deviceId, activation.action().wireName(), LicenseKeyCodec.mask(licenseKey));

        return new ActivationResult(
                activation.action(),
                s.id(),
                deviceId,
                s.tier(),
                s.features().asMap(),
                s.expiresAt(),
                s.isInGracePeriodAt(now),
                s.daysUntilExpiry(now),
                token
        );
    }

    /**
     * Never throws for business outcomes; a negative result carries the reason.
     * Storage failures still propagate.
     */
    public ValidationResult validate(String licenseKey, String deviceId, boolean updateLastSeen) {
        if (!keyCodec.validateFormat(licenseKey)) {
            log.debug("Validation rejected: malformed key {}", LicenseKeyCodec.mask(licenseKey));
            return ValidationResult.invalidKey();
        }
        Instant now = clock.instant();

        ValidationResult result = unitOfWork.execute(() -> {
            // only a last-seen update needs the row lock
            Optional<Subscription> found = updateLastSeen
                    ? repository.getSubscriptionByLicenseKey(licenseKey)
                    : repository.findSubscriptionByLicenseKey(licenseKey);
            if (found.isEmpty()) {
                return ValidationResult.invalidKey();
            }
            Subscription s = found.get();

            Optional<Device> device = s.findDevice(deviceId);
            if (device.isEmpty() || !device.get().isActive()) {
                return ValidationResult.rejected(ValidationReason.DEVICE_NOT_ACTIVATED,
                        s.id(), s.tier(), s.status(), s.expiresAt());
            }

            if (!s.isUsableAt(now)) {
                ValidationReason reason = s.isExpiredAt(now) ? ValidationReason.EXPIRED : ValidationReason.INACTIVE;
                return ValidationResult.rejected(reason, s.id(), s.tier(), s.status(), s.expiresAt());
            }

            if (updateLastSeen) {
                Device d = device.get();
                d.touch(now);
                repository.updateDevice(d);
            }

            return new ValidationResult(
                    true,
                    null,
                    s.id(),
                    s.tier(),
                    s.status(),
                    s.features().asMap(),
                    s.expiresAt(),
                    s.isInGracePeriodAt(now),
                    s.daysUntilExpiry(now)
            );
        });

        if (!result.valid()) {
            log.info("Validation negative key={} deviceId={} reason={}",
                    LicenseKeyCodec.mask(licenseKey), deviceId, result.reason().wireName());
        }
        return result;
    }

    /**
     * @return true when the device was bound to the subscription (it is now inactive)
     * @throws LicenseKeyInvalidException malformed or unknown key
     */
    public boolean deactivate(String licenseKey, String deviceId) {
        requireWellFormed(licenseKey);
        Instant now = clock.instant();

        boolean removed = unitOfWork.execute(() -> {
            Subscription s = load(licenseKey);
            Optional<Device> device = s.findDevice(deviceId);
            if (!s.removeDevice(deviceId, now)) {
                return false;
            }
            repository.updateDevice(device.get());
            repository.updateSubscription(s);
            return true;
        });

        if (removed) {
            log.info("Device deactivated key={} deviceId={}", LicenseKeyCodec.mask(licenseKey), deviceId);
        }
        return removed;
    }

    /**
     * Feature lookup against tier defaults and overrides. Does not check usability.
     */
    public FeatureCheck checkFeature(String licenseKey, String featureName) {
        requireWellFormed(licenseKey);
        if (featureName == null || featureName.isBlank()) {
            throw new IllegalArgumentException("featureName is required");
        }

        return unitOfWork.execute(() -> {
            Subscription s = load(licenseKey);
            FeatureSet features = s.features();
            boolean enabled = features.isEnabled(featureName);
            return new FeatureCheck(featureName, enabled, enabled ? features.limit(featureName) : null, s.tier());
        });
    }

    private Subscription load(String licenseKey) {
        return repository.getSubscriptionByLicenseKey(licenseKey).orElseThrow(() -> {
            log.warn("Unknown license key {}", LicenseKeyCodec.mask(licenseKey));
            return new LicenseKeyInvalidException("license key not found");
        });
    }

    private void requireWellFormed(String licenseKey) {
        if (!keyCodec.validateFormat(licenseKey)) {
            log.warn("Malformed license key {}", LicenseKeyCodec.mask(licenseKey));
            throw new LicenseKeyInvalidException("malformed license key");
        }
    }

    private static void ensureUsable(Subscription s, Instant now) {
        if (s.isUsableAt(now)) return;
        if (s.isExpiredAt(now)) {
            throw new SubscriptionExpiredException(s.id(), s.expiresAt());
        }
        throw new SubscriptionInactiveException(s.id(), s.status());
    }

    private static void requireDeviceId(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId is required");
        }
    }

    private record Activation(Subscription subscription, ActivationAction action) {}
}
