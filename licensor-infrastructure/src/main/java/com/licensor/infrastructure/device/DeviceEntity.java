package com.licensor.infrastructure.device;

import com.licensor.infrastructure.subscription.SubscriptionEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

/**
 * Device row. {@code device_id} is the client-supplied id, unique only within a subscription.
 */
@Entity
@Table(
    name = "devices",
    uniqueConstraints = @UniqueConstraint(name = "uk_devices_subscription_device", columnNames = {"subscription_id", "device_id"}),
    indexes = @Index(name = "ix_devices_subscription", columnList = "subscription_id")
)
public class DeviceEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "subscription_id", nullable = false, updatable = false)
  private UUID subscriptionId;

  // read-only side of subscription_id; carries the FK and the database-level cascade
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "subscription_id", insertable = false, updatable = false,
      foreignKey = @ForeignKey(name = "fk_devices_subscription"))
  @OnDelete(action = OnDeleteAction.CASCADE)
  private SubscriptionEntity subscription;

  @Column(name = "device_id", nullable = false, length = 255, updatable = false)
  private String deviceId;

  @Column(name = "device_name", length = 255)
  private String deviceName;

  @Column(name = "device_type", length = 64)
  private String deviceType;

  @Column(name = "fingerprint", length = 512)
  private String fingerprint;

  @Column(name = "os_name", length = 64)
  private String osName;

  @Column(name = "os_version", length = 64)
  private String osVersion;

  @Column(name = "app_version", length = 64)
  private String appVersion;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "released_by_cancellation", nullable = false)
  private boolean releasedByCancellation;

  @Column(name = "last_seen_at")
  private Instant lastSeenAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected DeviceEntity() {}

  public DeviceEntity(UUID id, UUID subscriptionId, String deviceId, Instant createdAt) {
    this.id = id;
    this.subscriptionId = subscriptionId;
    this.deviceId = deviceId;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public UUID getId() { return id; }
  public UUID getSubscriptionId() { return subscriptionId; }
  public String getDeviceId() { return deviceId; }
  public String getDeviceName() { return deviceName; }
  public String getDeviceType() { return deviceType; }
  public String getFingerprint() { return fingerprint; }
  public String getOsName() { return osName; }
  public String getOsVersion() { return osVersion; }
  public String getAppVersion() { return appVersion; }
  public boolean isActive() { return active; }
  public boolean isReleasedByCancellation() { return releasedByCancellation; }
  public Instant getLastSeenAt() { return lastSeenAt; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setDeviceName(String deviceName) { this.deviceName = deviceName; }
  public void setDeviceType(String deviceType) { this.deviceType = deviceType; }
  public void setFingerprint(String fingerprint) { this.fingerprint = fingerprint; }
  public void setOsName(String osName) { this.osName = osName; }
  public void setOsVersion(String osVersion) { this.osVersion = osVersion; }
  public void setAppVersion(String appVersion) { this.appVersion = appVersion; }
  public void setActive(boolean active) { this.active = active; }
  public void setReleasedByCancellation(boolean releasedByCancellation) { this.releasedByCancellation = releasedByCancellation; }
  public void setLastSeenAt(Instant lastSeenAt) { this.lastSeenAt = lastSeenAt; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
