package com.licensor.application.service;

import com.licensor.application.ports.LicenseTokenIssuer.IssuedToken;
import com.licensor.domain.subscription.SubscriptionTier;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ActivationResult(
        ActivationAction action,
        UUID subscriptionId,
        String deviceId,
        SubscriptionTier tier,
        Map<String, Object> features,
        Instant expiresAt,
        boolean inGracePeriod,
        Integer daysUntilExpiry,
        IssuedToken token
) {

    public String message() {
        return switch (action) {
            case CAN_ACTIVATE -> "Device activated successfully";
            case REACTIVATED -> "Device reactivated successfully";
            case ALREADY_ACTIVE -> "Device is already activated";
        };
    }
}
