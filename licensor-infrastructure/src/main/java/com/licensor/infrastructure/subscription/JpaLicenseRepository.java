package com.licensor.infrastructure.subscription;

import com.licensor.application.ports.LicenseRepository;
import com.licensor.application.ports.RepositoryException;
import com.licensor.domain.device.Device;
import com.licensor.domain.device.DeviceInfo;
import com.licensor.domain.subscription.Subscription;
import com.licensor.domain.subscription.SubscriptionStatus;
import com.licensor.domain.subscription.SubscriptionTier;
import com.licensor.infrastructure.device.DeviceEntity;
import com.licensor.infrastructure.device.DeviceRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Adapter: LicenseRepository on top of Spring Data JPA.
 *
 * Lookups by key or id take a PESSIMISTIC_WRITE lock on the subscription row before reading its
 * devices, so concurrent activations against one subscription serialise on that row.
 * {@link #findSubscriptionByLicenseKey} is the plain read for callers that write nothing back.
 * Must be called inside a transaction (see SpringUnitOfWork).
 */
@Component
public class JpaLicenseRepository implements LicenseRepository {

  private final SubscriptionRepository subscriptions;
  private final DeviceRepository devices;

  public JpaLicenseRepository(SubscriptionRepository subscriptions, DeviceRepository devices) {
    this.subscriptions = subscriptions;
    this.devices = devices;
  }

  @Override
  public Optional<Subscription> getSubscriptionByLicenseKey(String licenseKey) {
    return call("load subscription by key", () -> subscriptions.findByLicenseKeyForUpdate(licenseKey).map(this::toDomain));
  }

  @Override
  public Optional<Subscription> findSubscriptionByLicenseKey(String licenseKey) {
    return call("read subscription by key", () -> subscriptions.findByLicenseKey(licenseKey).map(this::toDomain));
  }

  @Override
  public Optional<Subscription> getSubscriptionById(UUID subscriptionId) {
    return call("load subscription " + subscriptionId, () -> subscriptions.findByIdForUpdate(subscriptionId).map(this::toDomain));
  }

  @Override
  public Subscription createSubscription(Subscription s) {
    return call("create subscription " + s.id(), () -> {
      SubscriptionEntity e = new SubscriptionEntity(s.id(), s.customerId(), s.licenseKey(), s.createdAt());
      apply(s, e);
      subscriptions.save(e);
      for (Device d : s.devices()) {
        devices.save(newDeviceEntity(d));
      }
      return s;
    });
  }

  @Override
  public void updateSubscription(Subscription s) {
    call("update subscription " + s.id(), () -> {
      SubscriptionEntity e = subscriptions.findById(s.id())
          .orElseThrow(() -> new RepositoryException("Subscription row missing: " + s.id()));
      apply(s, e);
      subscriptions.save(e);
      return null;
    });
  }

  @Override
  public void createDevice(Device d) {
    call("create device " + d.deviceId(), () -> devices.save(newDeviceEntity(d)));
  }

  @Override
  public void updateDevice(Device d) {
    call("update device " + d.deviceId(), () -> {
      DeviceEntity e = devices.findById(d.id())
          .orElseThrow(() -> new RepositoryException("Device row missing: " + d.id()));
      apply(d, e);
      devices.save(e);
      return null;
    });
  }

  @Override
  public boolean existsByLicenseKey(String licenseKey) {
    return call("check license key", () -> subscriptions.existsByLicenseKey(licenseKey));
  }

  @Override
  public List<Subscription> findSubscriptionsByCustomerId(UUID customerId) {
    return call("list subscriptions of " + customerId, () -> subscriptions.findByCustomerIdOrderByCreatedAtAsc(customerId)
        .stream()
        .map(this::toDomain)
        .toList());
  }

  private Subscription toDomain(SubscriptionEntity e) {
    List<Device> owned = devices.findBySubscriptionIdOrderByCreatedAtAscDeviceIdAsc(e.getId())
        .stream()
        .map(JpaLicenseRepository::toDomain)
        .toList();

    return Subscription.restore(
        e.getId(),
        e.getCustomerId(),
        e.getLicenseKey(),
        SubscriptionTier.parse(e.getTier()),
        SubscriptionStatus.valueOf(e.getStatus()),
        e.getStartsAt(),
        e.getExpiresAt(),
        e.getGracePeriodDays(),
        e.getMaxDevices(),
        e.getFeatureOverrides(),
        e.getCreatedAt(),
        e.getUpdatedAt(),
        owned
    );
  }

  private static Device toDomain(DeviceEntity e) {
    return Device.restore(
        e.getId(),
        e.getSubscriptionId(),
        e.getDeviceId(),
        new DeviceInfo(e.getDeviceName(), e.getDeviceType(), e.getFingerprint(),
            e.getOsName(), e.getOsVersion(), e.getAppVersion()),
        e.isActive(),
        e.isReleasedByCancellation(),
        e.getLastSeenAt(),
        e.getCreatedAt(),
        e.getUpdatedAt()
    );
  }

  private static void apply(Subscription s, SubscriptionEntity e) {
    e.setTier(s.tier().name());
    e.setStatus(s.status().name());
    e.setStartsAt(s.startsAt());
    e.setExpiresAt(s.expiresAt());
    e.setGracePeriodDays(s.gracePeriodDays());
    e.setMaxDevices(s.maxDevices());
    e.setFeatureOverrides(new LinkedHashMap<>(s.featureOverrides()));
    e.setUpdatedAt(s.updatedAt());
  }

  private static DeviceEntity newDeviceEntity(Device d) {
    if (d.subscriptionId() == null) {
      throw new RepositoryException("Device " + d.deviceId() + " is not bound to a subscription");
    }
    DeviceEntity e = new DeviceEntity(d.id(), d.subscriptionId(), d.deviceId(), d.createdAt());
    apply(d, e);
    return e;
  }

  private static void apply(Device d, DeviceEntity e) {
    e.setDeviceName(d.deviceName());
    e.setDeviceType(d.deviceType());
    e.setFingerprint(d.fingerprint());
    e.setOsName(d.osName());
    e.setOsVersion(d.osVersion());
    e.setAppVersion(d.appVersion());
    e.setActive(d.isActive());
    e.setReleasedByCancellation(d.isReleasedByCancellation());
    e.setLastSeenAt(d.lastSeenAt());
    e.setUpdatedAt(d.updatedAt());
  }

  private static <T> T call(String what, Supplier<T> op) {
    try {
      return op.get();
    } catch (DataAccessException e) {
      throw new RepositoryException("Storage failure: " + what, e);
    }
  }
}
