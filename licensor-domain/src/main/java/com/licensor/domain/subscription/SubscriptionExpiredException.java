package com.licensor.domain.subscription;

import com.licensor.domain.DomainException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public final class SubscriptionExpiredException extends DomainException {

    public SubscriptionExpiredException(UUID subscriptionId, Instant expiredAt) {
        super("SUBSCRIPTION_EXPIRED", "Subscription has expired", details(subscriptionId, expiredAt));
    }

    private static Map<String, Object> details(UUID subscriptionId, Instant expiredAt) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("subscription_id", subscriptionId.toString());
        if (expiredAt != null) {
            d.put("expired_at", expiredAt.toString());
        }
        return d;
    }
}
