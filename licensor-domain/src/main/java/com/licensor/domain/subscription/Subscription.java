package com.licensor.domain.subscription;

import com.licensor.domain.device.Device;
import com.licensor.domain.device.DeviceLimitExceededException;
import com.licensor.domain.feature.FeatureCatalog;
import com.licensor.domain.feature.FeatureSet;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Subscription aggregate: lifecycle status, validity window, feature inputs and the device list.
 *
 * All time-dependent questions take {@code now} explicitly; the aggregate never reads a clock.
 * Usability is always derived from (status, startsAt, expiresAt, gracePeriodDays, now).
 */
public final class Subscription {

    private final UUID id;
    private final UUID customerId;
    private final String licenseKey;
    private final Instant createdAt;
    private final List<Device> devices = new ArrayList<>();

    private SubscriptionTier tier;
    private SubscriptionStatus status;
    private Instant startsAt;
    private Instant expiresAt;
    private int gracePeriodDays;
    private int maxDevices;
    private Map<String, Object> featureOverrides;
    private Instant updatedAt;

    private Subscription(UUID id,
                         UUID customerId,
                         String licenseKey,
                         Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.customerId = Objects.requireNonNull(customerId, "customerId");
        this.licenseKey = requireText(licenseKey, "licenseKey");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * New subscription in PENDING status. Callers activate it explicitly.
     */
    public static Subscription create(UUID customerId,
                                      String licenseKey,
                                      SubscriptionTier tier,
                                      int maxDevices,
                                      int gracePeriodDays,
                                      Map<String, ?> featureOverrides,
                                      Instant startsAt,
                                      Instant expiresAt,
                                      Instant now) {
        Subscription s = new Subscription(UUID.randomUUID(), customerId, licenseKey, now);
        s.tier = Objects.requireNonNull(tier, "tier");
        s.status = SubscriptionStatus.PENDING;
        s.startsAt = startsAt == null ? now : startsAt;
        s.expiresAt = expiresAt;
        s.maxDevices = requireMaxDevices(maxDevices);
        s.gracePeriodDays = requireGrace(gracePeriodDays);
        s.featureOverrides = FeatureSet.normalize(featureOverrides);
        s.updatedAt = now;
        if (expiresAt != null && expiresAt.isBefore(s.startsAt)) {
            throw new IllegalArgumentException("expiresAt must not be before startsAt");
        }
        return s;
    }

    /**
     * Rehydrate from persistence. Devices are attached as given; no limit check is applied.
     */
    public static Subscription restore(UUID id,
                                       UUID customerId,
                                       String licenseKey,
                                       SubscriptionTier tier,
                                       SubscriptionStatus status,
                                       Instant startsAt,
                                       Instant expiresAt,
                                       int gracePeriodDays,
                                       int maxDevices,
                                       Map<String, ?> featureOverrides,
                                       Instant createdAt,
                                       Instant updatedAt,
                                       List<Device> devices) {
        Subscription s = new Subscription(id, customerId, licenseKey, createdAt);
        s.tier = Objects.requireNonNull(tier, "tier");
        s.status = Objects.requireNonNull(status, "status");
        s.startsAt = Objects.requireNonNull(startsAt, "startsAt");
        s.expiresAt = expiresAt;
        s.gracePeriodDays = gracePeriodDays;
        s.maxDevices = maxDevices;
        s.featureOverrides = FeatureSet.normalize(featureOverrides);
        s.updatedAt = updatedAt == null ? createdAt : updatedAt;
        if (devices != null) {
            for (Device d : devices) {
                d.bindTo(id);
                s.devices.add(d);
            }
        }
        return s;
    }

    // ---- lifecycle ----

    public void activate(Instant now) {
        if (status == SubscriptionStatus.EXPIRED) {
            throw new IllegalSubscriptionTransitionException(status, "activate");
        }
        this.status = SubscriptionStatus.ACTIVE;
        this.updatedAt = now;
    }

    public void suspend(Instant now) {
        this.status = SubscriptionStatus.SUSPENDED;
        this.updatedAt = now;
    }

    /**
     * Cancels and switches off every active device, remembering which ones were in use.
     * Calling it again is harmless: already inactive devices keep their marker.
     */
    public void cancel(Instant now) {
        this.status = SubscriptionStatus.CANCELLED;
        for (Device d : devices) {
            d.releaseForCancellation(now);
        }
        this.updatedAt = now;
    }

    /**
     * SUSPENDED/CANCELLED -> ACTIVE. Devices released by cancellation come back in registration
     * order while slots remain; the rest lose their marker and stay inactive.
     *
     * @return devices switched back on
     */
    public List<Device> resume(Instant now) {
        if (status != SubscriptionStatus.SUSPENDED && status != SubscriptionStatus.CANCELLED) {
            throw new IllegalSubscriptionTransitionException(status, "resume");
        }
        this.status = SubscriptionStatus.ACTIVE;

        List<Device> restored = new ArrayList<>();
        for (Device d : devices) {
            if (!d.isReleasedByCancellation()) continue;
            if (canAddDevice()) {
                d.activate(now);
                restored.add(d);
            } else {
                d.deactivate(now);
            }
        }
        this.updatedAt = now;
        return restored;
    }

    public void extendExpiry(int days, Instant now) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1");
        }
        Instant base = expiresAt == null ? now : expiresAt;
        this.expiresAt = base.plus(Duration.ofDays(days));
        this.updatedAt = now;
    }

    /**
     * Replaces feature inputs. A null override map clears the overrides.
     */
    public void updateTier(SubscriptionTier newTier, Map<String, ?> overrides, Instant now) {
        this.tier = Objects.requireNonNull(newTier, "newTier");
        this.featureOverrides = FeatureSet.normalize(overrides);
        this.updatedAt = now;
    }

    /**
     * Lowering maxDevices below the active count does not switch devices off; it only blocks new slots.
     */
    public void changeLimits(int maxDevices, int gracePeriodDays, Instant now) {
        this.maxDevices = requireMaxDevices(maxDevices);
        this.gracePeriodDays = requireGrace(gracePeriodDays);
        this.updatedAt = now;
    }

    // ---- time window ----

    public boolean isUsableAt(Instant now) {
        if (status != SubscriptionStatus.ACTIVE) return false;
        if (now.isBefore(startsAt)) return false;
        return expiresAt == null || !now.isAfter(graceEndsAt());
    }

    public boolean isInGracePeriodAt(Instant now) {
        if (expiresAt == null) return false;
        return now.isAfter(expiresAt) && !now.isAfter(graceEndsAt());
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(graceEndsAt());
    }

    /**
     * Whole days until expiresAt, floored at 0. Null when the subscription never expires.
     */
    public Integer daysUntilExpiry(Instant now) {
        if (expiresAt == null) return null;
        long days = Duration.between(now, expiresAt).toDays();
        return (int) Math.max(0L, days);
    }

    public Instant graceEndsAt() {
        return expiresAt == null ? null : expiresAt.plus(Duration.ofDays(gracePeriodDays));
    }

    // ---- devices ----

    public long activeDeviceCount() {
        return devices.stream().filter(Device::isActive).count();
    }

    public boolean canAddDevice() {
        return activeDeviceCount() < maxDevices;
    }

    public void addDevice(Device device, Instant now) {
        Objects.requireNonNull(device, "device");
        if (findDevice(device.deviceId()).isPresent()) {
            throw new IllegalStateException("device already bound: " + device.deviceId());
        }
        ensureSlot();
        device.bindTo(id);
        devices.add(device);
        this.updatedAt = now;
    }

    /**
     * Switches a bound, inactive device back on. Consumes a slot like a new device.
     */
    public void reactivateDevice(Device device, Instant now) {
        Objects.requireNonNull(device, "device");
        if (!devices.contains(device)) {
            throw new IllegalArgumentException("device is not bound to subscription " + id);
        }
        if (device.isActive()) return;
        ensureSlot();
        device.activate(now);
        this.updatedAt = now;
    }

    /**
     * @return true when a device with this client id is bound (already inactive counts as found)
     */
    public boolean removeDevice(String deviceId, Instant now) {
        Optional<Device> found = findDevice(deviceId);
        if (found.isEmpty()) return false;
        found.get().deactivate(now);
        this.updatedAt = now;
        return true;
    }

    public Optional<Device> findDevice(String deviceId) {
        if (deviceId == null) return Optional.empty();
        for (Device d : devices) {
            if (d.deviceId().equals(deviceId)) return Optional.of(d);
        }
        return Optional.empty();
    }

    private void ensureSlot() {
        if (!canAddDevice()) {
            throw new DeviceLimitExceededException((int) activeDeviceCount(), maxDevices);
        }
    }

    // ---- features ----

    public FeatureSet features() {
        return FeatureCatalog.resolve(tier, featureOverrides);
    }

    private static int requireMaxDevices(int maxDevices) {
        if (maxDevices < 1) throw new IllegalArgumentException("maxDevices must be >= 1");
        return maxDevices;
    }

    private static int requireGrace(int gracePeriodDays) {
        if (gracePeriodDays < 0) throw new IllegalArgumentException("gracePeriodDays must be >= 0");
        return gracePeriodDays;
    }

    private static String requireText(String v, String name) {
        if (v == null || v.isBlank()) throw new IllegalArgumentException(name + " is required");
        return v;
    }

    public UUID id() { return id; }
    public UUID customerId() { return customerId; }
    public String licenseKey() { return licenseKey; }
    public SubscriptionTier tier() { return tier; }
    public SubscriptionStatus status() { return status; }
    public Instant startsAt() { return startsAt; }
    public Instant expiresAt() { return expiresAt; }
    public int gracePeriodDays() { return gracePeriodDays; }
    public int maxDevices() { return maxDevices; }
    public Map<String, Object> featureOverrides() { return Collections.unmodifiableMap(featureOverrides); }
    public Instant createdAt() { return createdAt; }
    public Instant updatedAt() { return updatedAt; }
    public List<Device> devices() { return Collections.unmodifiableList(devices); }
}
