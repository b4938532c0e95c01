package com.licensor.domain.subscription;

import com.licensor.domain.DomainException;

import java.util.Map;
import java.util.UUID;

public final class SubscriptionNotFoundException extends DomainException {

    public SubscriptionNotFoundException(UUID subscriptionId) {
        super("SUBSCRIPTION_NOT_FOUND", "Subscription not found", Map.of("subscription_id", subscriptionId.toString()));
    }
}
