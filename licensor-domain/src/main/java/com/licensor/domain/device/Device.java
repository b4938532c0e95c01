package com.licensor.domain.device;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A device bound to one subscription.
 *
 * Devices are never removed from their subscription: deactivation only flips the active flag, so
 * the device's own flags are the record of whether it was in use. {@code releasedByCancellation}
 * is set when a subscription cancellation (not the customer) switched the device off.
 */
public final class Device {

    private final UUID id;
    private final String deviceId;
    private final Instant createdAt;

    private UUID subscriptionId;
    private String deviceName;
    private String deviceType;
    private String fingerprint;
    private String osName;
    private String osVersion;
    private String appVersion;
    private boolean active;
    private boolean releasedByCancellation;
    private Instant lastSeenAt;
    private Instant updatedAt;

    private Device(UUID id, String deviceId, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.deviceId = requireDeviceId(deviceId);
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    public static Device register(String deviceId, DeviceInfo info, Instant now) {
        Device d = new Device(UUID.randomUUID(), deviceId, now);
        d.applyInfo(info == null ? DeviceInfo.empty() : info);
        d.active = true;
        d.lastSeenAt = now;
        return d;
    }

    /**
     * Rehydrate from persistence.
     */
    public static Device restore(UUID id,
                                 UUID subscriptionId,
                                 String deviceId,
                                 DeviceInfo info,
                                 boolean active,
                                 boolean releasedByCancellation,
                                 Instant lastSeenAt,
                                 Instant createdAt,
                                 Instant updatedAt) {
        Device d = new Device(id, deviceId, createdAt);
        d.subscriptionId = subscriptionId;
        d.applyInfo(info == null ? DeviceInfo.empty() : info);
        d.active = active;
        d.releasedByCancellation = releasedByCancellation;
        d.lastSeenAt = lastSeenAt;
        d.updatedAt = updatedAt == null ? createdAt : updatedAt;
        return d;
    }

    public void bindTo(UUID subscriptionId) {
        this.subscriptionId = Objects.requireNonNull(subscriptionId, "subscriptionId");
    }

    public void activate(Instant now) {
        this.active = true;
        this.releasedByCancellation = false;
        this.updatedAt = now;
    }

    public void deactivate(Instant now) {
        this.active = false;
        this.releasedByCancellation = false;
        this.updatedAt = now;
    }

    public void releaseForCancellation(Instant now) {
        if (!active) return;
        this.active = false;
        this.releasedByCancellation = true;
        this.updatedAt = now;
    }

    public void touch(Instant now) {
        this.lastSeenAt = now;
        this.updatedAt = now;
    }

    /**
     * Non-null fields of {@code info} replace the stored description.
     */
    public void updateInfo(DeviceInfo info, Instant now) {
        if (info == null) return;
        applyInfo(info);
        this.updatedAt = now;
    }

    private void applyInfo(DeviceInfo info) {
        if (info.deviceName() != null) this.deviceName = info.deviceName();
        if (info.deviceType() != null) this.deviceType = info.deviceType();
        if (info.fingerprint() != null) this.fingerprint = info.fingerprint();
        if (info.osName() != null) this.osName = info.osName();
        if (info.osVersion() != null) this.osVersion = info.osVersion();
        if (info.appVersion() != null) this.appVersion = info.appVersion();
    }

    private static String requireDeviceId(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId is required");
        }
        return deviceId;
    }

    public UUID id() { return id; }
    public UUID subscriptionId() { return subscriptionId; }
    public String deviceId() { return deviceId; }
    public String deviceName() { return deviceName; }
    public String deviceType() { return deviceType; }
    public String fingerprint() { return fingerprint; }
    public String osName() { return osName; }
    public String osVersion() { return osVersion; }
    public String appVersion() { return appVersion; }
    public boolean isActive() { return active; }
    public boolean isReleasedByCancellation() { return releasedByCancellation; }
    public Instant lastSeenAt() { return lastSeenAt; }
    public Instant createdAt() { return createdAt; }
    public Instant updatedAt() { return updatedAt; }

    public DeviceInfo info() {
        return new DeviceInfo(deviceName, deviceType, fingerprint, osName, osVersion, appVersion);
    }
}
