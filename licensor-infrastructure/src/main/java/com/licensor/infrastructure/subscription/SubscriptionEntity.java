package com.licensor.infrastructure.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
    name = "subscriptions",
    uniqueConstraints = @UniqueConstraint(name = "uk_subscriptions_license_key", columnNames = "license_key"),
    indexes = {
        @Index(name = "ix_subscriptions_customer", columnList = "customer_id"),
        @Index(name = "ix_subscriptions_status", columnList = "status")
    }
)
public class SubscriptionEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "customer_id", nullable = false)
  private UUID customerId;

  @Column(name = "license_key", nullable = false, length = 64, updatable = false)
  private String licenseKey;

  @Column(name = "tier", nullable = false, length = 30)
  private String tier;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  @Column(name = "starts_at", nullable = false)
  private Instant startsAt;

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "grace_period_days", nullable = false)
  private int gracePeriodDays;

  @Column(name = "max_devices", nullable = false)
  private int maxDevices;

  @Convert(converter = FeatureOverridesConverter.class)
  @Column(name = "feature_overrides", length = 4000)
  private Map<String, Object> featureOverrides = new HashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SubscriptionEntity() {}

  public SubscriptionEntity(UUID id, UUID customerId, String licenseKey, Instant createdAt) {
    this.id = id;
    this.customerId = customerId;
    this.licenseKey = licenseKey;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public UUID getId() { return id; }
  public UUID getCustomerId() { return customerId; }
  public String getLicenseKey() { return licenseKey; }
  public String getTier() { return tier; }
  public String getStatus() { return status; }
  public Instant getStartsAt() { return startsAt; }
  public Instant getExpiresAt() { return expiresAt; }
  public int getGracePeriodDays() { return gracePeriodDays; }
  public int getMaxDevices() { return maxDevices; }
  public Map<String, Object> getFeatureOverrides() { return featureOverrides; }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setTier(String tier) { this.tier = tier; }
  public void setStatus(String status) { this.status = status; }
  public void setStartsAt(Instant startsAt) { this.startsAt = startsAt; }
  public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
  public void setGracePeriodDays(int gracePeriodDays) { this.gracePeriodDays = gracePeriodDays; }
  public void setMaxDevices(int maxDevices) { this.maxDevices = maxDevices; }
  public void setFeatureOverrides(Map<String, Object> featureOverrides) { this.featureOverrides = featureOverrides; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
