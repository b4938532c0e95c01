package com.licensor.application.service;

import com.licensor.domain.subscription.SubscriptionTier;

import java.util.Map;
import java.util.UUID;

/**
 * @param durationDays    null for a subscription that never expires
 * @param gracePeriodDays null to use the configured default
 */
public record CreateSubscriptionCommand(
        UUID customerId,
        SubscriptionTier tier,
        Integer durationDays,
        int maxDevices,
        Integer gracePeriodDays,
        Map<String, Object> featureOverrides
) {}
