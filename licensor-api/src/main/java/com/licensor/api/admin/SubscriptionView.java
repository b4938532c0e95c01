package com.licensor.api.admin;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.licensor.domain.device.Device;
import com.licensor.domain.subscription.Subscription;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Operator view of a subscription. {@code status} reports "expired" once the grace period is over,
 * whatever the stored status says.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriptionView(
    UUID id,
    UUID customerId,
    String licenseKey,
    String tier,
    String status,
    Instant startsAt,
    Instant expiresAt,
    int gracePeriodDays,
    boolean inGracePeriod,
    Integer daysUntilExpiry,
    int maxDevices,
    long activeDevices,
    Map<String, Object> featureOverrides,
    Map<String, Object> features,
    Instant createdAt,
    Instant updatedAt,
    List<DeviceView> devices
) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DeviceView(
      UUID id,
      String deviceId,
      String deviceName,
      String deviceType,
      String osName,
      String osVersion,
      String appVersion,
      boolean active,
      Instant lastSeenAt,
      Instant createdAt
  ) {
    static DeviceView of(Device d) {
      return new DeviceView(d.id(), d.deviceId(), d.deviceName(), d.deviceType(), d.osName(), d.osVersion(),
          d.appVersion(), d.isActive(), d.lastSeenAt(), d.createdAt());
    }
  }

  public static SubscriptionView of(Subscription s, Instant now) {
    String status = s.isExpiredAt(now) ? "expired" : s.status().name().toLowerCase(Locale.ROOT);
    return new SubscriptionView(
        s.id(),
        s.customerId(),
        s.licenseKey(),
        s.tier().wireName(),
        status,
        s.startsAt(),
        s.expiresAt(),
        s.gracePeriodDays(),
        s.isInGracePeriodAt(now),
        s.daysUntilExpiry(now),
        s.maxDevices(),
        s.activeDeviceCount(),
        s.featureOverrides(),
        s.features().asMap(),
        s.createdAt(),
        s.updatedAt(),
        s.devices().stream().map(DeviceView::of).toList()
    );
  }
}
