package com.licensor.domain.feature;

import com.licensor.domain.subscription.SubscriptionTier;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureCatalogTest {

    @Test
    void everyTierHasDefaults() {
        for (SubscriptionTier tier : SubscriptionTier.values()) {
            assertThat(FeatureCatalog.defaults(tier))
                    .containsKeys(FeatureCatalog.MAX_CUSTOMERS, FeatureCatalog.ANALYTICS, FeatureCatalog.API_ACCESS);
        }
    }

    @Test
    void overridesWinOverTierDefaults() {
        FeatureSet fs = FeatureCatalog.resolve(SubscriptionTier.BASIC,
                Map.of("analytics", true, "max_customers", 250));

        assertThat(fs.isEnabled("analytics")).isTrue();
        assertThat(fs.limit("max_customers")).isEqualTo(250L);
        assertThat(fs.limit("max_products")).isEqualTo(500L);
    }

    @Test
    void unknownFeatureIsDisabled() {
        FeatureSet fs = FeatureCatalog.resolve(SubscriptionTier.ENTERPRISE, null);
        assertThat(fs.isEnabled("teleportation")).isFalse();
        assertThat(fs.limit("teleportation")).isNull();
    }

    @Test
    void unlimitedCountsAsEnabled() {
        FeatureSet fs = FeatureCatalog.resolve(SubscriptionTier.ENTERPRISE, Map.of());
        assertThat(fs.isEnabled("max_customers")).isTrue();
        assertThat(fs.limit("max_customers")).isEqualTo(-1L);
    }

    @Test
    void numbersAreNormalisedToLong() {
        FeatureSet fromInts = FeatureCatalog.resolve(SubscriptionTier.TRIAL, Map.of("max_products", 75));
        FeatureSet fromParsed = FeatureCatalog.resolve(SubscriptionTier.TRIAL, Map.of("max_products", BigInteger.valueOf(75)));

        assertThat(fromInts).isEqualTo(fromParsed);
        assertThat(fromInts.value("max_products")).isInstanceOf(Long.class);
    }

    @Test
    void rejectsNonScalarValues() {
        assertThatThrownBy(() -> FeatureCatalog.resolve(SubscriptionTier.BASIC, Map.of("analytics", "yes")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeatureCatalog.resolve(SubscriptionTier.BASIC, Map.of("max_customers", 1.5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FeatureCatalog.resolve(SubscriptionTier.BASIC, Map.of("max_customers", 1e20)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> FeatureCatalog.resolve(SubscriptionTier.BASIC,
                Map.of("max_customers", new BigInteger("99999999999999999999"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> FeatureCatalog.resolve(SubscriptionTier.BASIC,
                Map.of("max_customers", new BigDecimal("12.5"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acceptsWholeNumbersAtTheLongBoundary() {
        assertThat(FeatureSet.normalize(Map.of("max_customers", new BigInteger(String.valueOf(Long.MAX_VALUE)))))
                .containsEntry("max_customers", Long.MAX_VALUE);
        assertThat(FeatureSet.normalize(Map.of("max_customers", 1e18)))
                .containsEntry("max_customers", 1_000_000_000_000_000_000L);
        assertThat(FeatureSet.normalize(Map.of("max_customers", new BigDecimal("250.000"))))
                .containsEntry("max_customers", 250L);
    }
}
