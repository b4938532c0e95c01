package com.licensor.domain.subscription;

import java.util.Locale;

public enum SubscriptionTier {
    BASIC,
    PROFESSIONAL,
    ENTERPRISE,
    TRIAL;

    /**
     * Lenient parse used at the API and storage boundaries ("basic", " Enterprise ").
     */
    public static SubscriptionTier parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("tier is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tier: " + value);
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
