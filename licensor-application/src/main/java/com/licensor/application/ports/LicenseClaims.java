package com.licensor.application.ports;

import com.licensor.domain.subscription.Subscription;
import com.licensor.domain.subscription.SubscriptionTier;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * License fields carried by a signed token.
 *
 * @param expiresAt subscription expiry (null = never), not the token expiry
 */
public record LicenseClaims(
        UUID subscriptionId,
        UUID customerId,
        SubscriptionTier tier,
        Map<String, Object> features,
        String deviceId,
        Instant expiresAt,
        int gracePeriodDays
) {

    public LicenseClaims {
        Objects.requireNonNull(subscriptionId, "subscriptionId");
        Objects.requireNonNull(customerId, "customerId");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(deviceId, "deviceId");
        features = features == null ? Map.of() : Map.copyOf(features);
    }

    public static LicenseClaims of(Subscription s, String deviceId) {
        return new LicenseClaims(
                s.id(),
                s.customerId(),
                s.tier(),
                s.features().asMap(),
                deviceId,
                s.expiresAt(),
                s.gracePeriodDays()
        );
    }
}
