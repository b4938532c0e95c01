package com.licensor.application.ports.impl;

import com.licensor.application.ports.LicenseRepository;
import com.licensor.application.ports.RepositoryException;
import com.licensor.domain.device.Device;
import com.licensor.domain.device.DeviceInfo;
import com.licensor.domain.subscription.Subscription;
import com.licensor.domain.subscription.SubscriptionStatus;
import com.licensor.domain.subscription.SubscriptionTier;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Row-shaped in-memory store. Loads always rebuild a fresh aggregate, so nothing a caller
 * changes is visible to others until it is written back.
 */
public final class InMemoryLicenseRepository implements LicenseRepository {

    private record SubscriptionRow(UUID id, UUID customerId, String licenseKey, SubscriptionTier tier,
                                   SubscriptionStatus status, Instant startsAt, Instant expiresAt,
                                   int gracePeriodDays, int maxDevices, Map<String, Object> overrides,
                                   Instant createdAt, Instant updatedAt) {}

    private record DeviceRow(UUID id, UUID subscriptionId, String deviceId, DeviceInfo info, boolean active,
                             boolean releasedByCancellation, Instant lastSeenAt, Instant createdAt, Instant updatedAt) {}

    private final Map<UUID, SubscriptionRow> subscriptions = new ConcurrentHashMap<>();
    private final Map<UUID, DeviceRow> devices = new ConcurrentHashMap<>();

    private final AtomicInteger lockingReads = new AtomicInteger();

    private volatile boolean failing;

    public void failWrites(boolean failing) {
        this.failing = failing;
    }

    public long deviceRowCount(UUID subscriptionId) {
        return devices.values().stream().filter(d -> d.subscriptionId().equals(subscriptionId)).count();
    }

    /** Number of lookups that would have taken the row lock in a real store. */
    public int lockingReads() {
        return lockingReads.get();
    }

    public long activeDeviceRowCount(UUID subscriptionId) {
        return devices.values().stream()
                .filter(d -> d.subscriptionId().equals(subscriptionId))
                .filter(DeviceRow::active)
                .count();
    }

    @Override
    public Optional<Subscription> getSubscriptionByLicenseKey(String licenseKey) {
        lockingReads.incrementAndGet();
        return findSubscriptionByLicenseKey(licenseKey);
    }

    @Override
    public Optional<Subscription> findSubscriptionByLicenseKey(String licenseKey) {
        return subscriptions.values().stream()
                .filter(r -> r.licenseKey().equals(licenseKey))
                .findFirst()
                .map(this::toDomain);
    }

    @Override
    public Optional<Subscription> getSubscriptionById(UUID subscriptionId) {
        lockingReads.incrementAndGet();
        return Optional.ofNullable(subscriptions.get(subscriptionId)).map(this::toDomain);
    }

    @Override
    public Subscription createSubscription(Subscription s) {
        checkWritable();
        if (existsByLicenseKey(s.licenseKey())) {
            throw new RepositoryException("duplicate license key");
        }
        subscriptions.put(s.id(), toRow(s));
        return s;
    }

    @Override
    public void updateSubscription(Subscription s) {
        checkWritable();
        if (!subscriptions.containsKey(s.id())) {
            throw new RepositoryException("no subscription row " + s.id());
        }
        subscriptions.put(s.id(), toRow(s));
    }

    @Override
    public void createDevice(Device d) {
        checkWritable();
        boolean duplicate = devices.values().stream()
                .anyMatch(r -> r.subscriptionId().equals(d.subscriptionId()) && r.deviceId().equals(d.deviceId()));
        if (duplicate) {
            throw new RepositoryException("duplicate device " + d.deviceId());
        }
        devices.put(d.id(), toRow(d));
    }

    @Override
    public void updateDevice(Device d) {
        checkWritable();
        if (!devices.containsKey(d.id())) {
            throw new RepositoryException("no device row " + d.id());
        }
        devices.put(d.id(), toRow(d));
    }

    @Override
    public boolean existsByLicenseKey(String licenseKey) {
        return subscriptions.values().stream().anyMatch(r -> r.licenseKey().equals(licenseKey));
    }

    @Override
    public List<Subscription> findSubscriptionsByCustomerId(UUID customerId) {
        return subscriptions.values().stream()
                .filter(r -> r.customerId().equals(customerId))
                .sorted(Comparator.comparing(SubscriptionRow::createdAt))
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    private void checkWritable() {
        if (failing) throw new RepositoryException("storage unavailable");
    }

    private Subscription toDomain(SubscriptionRow r) {
        List<Device> owned = devices.values().stream()
                .filter(d -> d.subscriptionId().equals(r.id()))
                .sorted(Comparator.comparing(DeviceRow::createdAt).thenComparing(DeviceRow::deviceId))
                .map(d -> Device.restore(d.id(), d.subscriptionId(), d.deviceId(), d.info(), d.active(),
                        d.releasedByCancellation(), d.lastSeenAt(), d.createdAt(), d.updatedAt()))
                .collect(Collectors.toList());
        return Subscription.restore(r.id(), r.customerId(), r.licenseKey(), r.tier(), r.status(), r.startsAt(),
                r.expiresAt(), r.gracePeriodDays(), r.maxDevices(), r.overrides(), r.createdAt(), r.updatedAt(), owned);
    }

    private static SubscriptionRow toRow(Subscription s) {
        return new SubscriptionRow(s.id(), s.customerId(), s.licenseKey(), s.tier(), s.status(), s.startsAt(),
                s.expiresAt(), s.gracePeriodDays(), s.maxDevices(), Map.copyOf(s.featureOverrides()),
                s.createdAt(), s.updatedAt());
    }

    private static DeviceRow toRow(Device d) {
        return new DeviceRow(d.id(), d.subscriptionId(), d.deviceId(), d.info(), d.isActive(),
                d.isReleasedByCancellation(), d.lastSeenAt(), d.createdAt(), d.updatedAt());
    }
}
