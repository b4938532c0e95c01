package com.licensor.application.service;

import com.licensor.domain.subscription.SubscriptionStatus;
import com.licensor.domain.subscription.SubscriptionTier;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of a license validation. Negative outcomes carry a reason and whatever
 * subscription context was available when the check stopped.
 */
public record ValidationResult(
        boolean valid,
        ValidationReason reason,
        UUID subscriptionId,
        SubscriptionTier tier,
        SubscriptionStatus status,
        Map<String, Object> features,
        Instant expiresAt,
        boolean inGracePeriod,
        Integer daysUntilExpiry
) {

    static ValidationResult invalidKey() {
        return new ValidationResult(false, ValidationReason.INVALID_LICENSE_KEY,
                null, null, null, Map.of(), null, false, null);
    }

    static ValidationResult rejected(ValidationReason reason,
                                     UUID subscriptionId,
                                     SubscriptionTier tier,
                                     SubscriptionStatus status,
                                     Instant expiresAt) {
        return new ValidationResult(false, reason, subscriptionId, tier, status, Map.of(), expiresAt, false, null);
    }

    public String message() {
        if (valid) return "License is valid";
        return switch (reason) {
            case INVALID_LICENSE_KEY -> "License key is invalid";
            case DEVICE_NOT_ACTIVATED -> "Device not activated for this subscription";
            case EXPIRED -> "Subscription is expired";
            case INACTIVE -> "Subscription is inactive";
        };
    }
}
