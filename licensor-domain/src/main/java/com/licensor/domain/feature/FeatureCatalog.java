package com.licensor.domain.feature;

import com.licensor.domain.subscription.SubscriptionTier;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tier -> default capability map.
 * Numeric limits use -1 for "unlimited".
 */
public final class FeatureCatalog {

    public static final String MAX_CUSTOMERS = "max_customers";
    public static final String MAX_PRODUCTS = "max_products";
    public static final String ANALYTICS = "analytics";
    public static final String MULTI_LOCATION = "multi_location";
    public static final String API_ACCESS = "api_access";
    public static final String PRIORITY_SUPPORT = "priority_support";

    private FeatureCatalog() {}

    public static Map<String, Object> defaults(SubscriptionTier tier) {
        return switch (tier) {
            case BASIC -> features(100, 500, false, false, false, false);
            case PROFESSIONAL -> features(1000, 5000, true, true, true, false);
            case ENTERPRISE -> features(-1, -1, true, true, true, true);
            case TRIAL -> features(10, 50, false, false, false, false);
        };
    }

    public static FeatureSet resolve(SubscriptionTier tier, Map<String, ?> overrides) {
        return FeatureSet.of(defaults(tier), overrides);
    }

    private static Map<String, Object> features(long maxCustomers,
                                                long maxProducts,
                                                boolean analytics,
                                                boolean multiLocation,
                                                boolean apiAccess,
                                                boolean prioritySupport) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(MAX_CUSTOMERS, maxCustomers);
        m.put(MAX_PRODUCTS, maxProducts);
        m.put(ANALYTICS, analytics);
        m.put(MULTI_LOCATION, multiLocation);
        m.put(API_ACCESS, apiAccess);
        m.put(PRIORITY_SUPPORT, prioritySupport);
        return m;
    }
}
