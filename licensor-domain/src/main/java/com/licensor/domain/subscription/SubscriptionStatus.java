package com.licensor.domain.subscription;

/**
 * Stored lifecycle status.
 *
 * EXPIRED is never the target of a transition: expiry is derived from the timing fields at read
 * time. A stored EXPIRED value is only ever treated as "not active".
 */
public enum SubscriptionStatus {
    PENDING,
    ACTIVE,
    SUSPENDED,
    CANCELLED,
    EXPIRED
}
