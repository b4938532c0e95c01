package com.licensor.application.ports;

import com.licensor.domain.device.Device;
import com.licensor.domain.subscription.Subscription;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage boundary for the subscription aggregate.
 *
 * Lookups return the aggregate with all of its devices. Inside a {@link UnitOfWork} a loaded
 * subscription stays locked against concurrent writers until the unit of work ends, so a
 * device-limit check and the insert that follows it cannot interleave with another request.
 *
 * Every method fails with {@link RepositoryException} on storage faults.
 */
public interface LicenseRepository {

    Optional<Subscription> getSubscriptionByLicenseKey(String licenseKey);

    /**
     * Same lookup as {@link #getSubscriptionByLicenseKey} without the write lock. The result must not be
     * written back.
     */
    Optional<Subscription> findSubscriptionByLicenseKey(String licenseKey);

    Optional<Subscription> getSubscriptionById(UUID subscriptionId);

    Subscription createSubscription(Subscription subscription);

    /**
     * Persists the root fields only. Device changes go through {@link #createDevice} / {@link #updateDevice}.
     */
    void updateSubscription(Subscription subscription);

    void createDevice(Device device);

    void updateDevice(Device device);

    boolean existsByLicenseKey(String licenseKey);

    List<Subscription> findSubscriptionsByCustomerId(UUID customerId);
}
