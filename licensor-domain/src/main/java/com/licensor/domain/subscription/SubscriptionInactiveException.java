package com.licensor.domain.subscription;

import com.licensor.domain.DomainException;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * The subscription is within its validity window but its status (or start date) does not allow use.
 */
public final class SubscriptionInactiveException extends DomainException {

    private final SubscriptionStatus status;

    public SubscriptionInactiveException(UUID subscriptionId, SubscriptionStatus status) {
        super("SUBSCRIPTION_INACTIVE", "Subscription is not active",
                Map.of("subscription_id", subscriptionId.toString(), "status", status.name().toLowerCase(Locale.ROOT)));
        this.status = status;
    }

    public SubscriptionStatus status() {
        return status;
    }
}
