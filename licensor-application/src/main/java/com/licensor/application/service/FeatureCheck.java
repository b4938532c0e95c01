package com.licensor.application.service;

import com.licensor.domain.subscription.SubscriptionTier;

/**
 * @param limit numeric limit when the feature is numeric and enabled, otherwise null (-1 = unlimited)
 */
public record FeatureCheck(String feature, boolean enabled, Long limit, SubscriptionTier tier) {}
