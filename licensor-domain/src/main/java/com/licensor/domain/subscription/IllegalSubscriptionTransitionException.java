package com.licensor.domain.subscription;

import com.licensor.domain.DomainException;

import java.util.Map;

public final class IllegalSubscriptionTransitionException extends DomainException {

    public IllegalSubscriptionTransitionException(SubscriptionStatus from, String operation) {
        super("ILLEGAL_TRANSITION", "Cannot " + operation + " a subscription in status " + from,
                Map.of("status", from.name().toLowerCase(), "operation", operation));
    }
}
