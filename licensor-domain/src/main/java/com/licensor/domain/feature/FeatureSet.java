package com.licensor.domain.feature;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved capability map of a subscription: tier defaults with overrides applied on top.
 *
 * Values are either Boolean or Long. Any integral number handed in (Integer from code, BigInteger
 * or Long from a JSON parser) is normalised to Long so two sets built from the same logical values
 * compare equal. Unknown names read as disabled.
 */
public final class FeatureSet {

    private final Map<String, Object> values;

    private FeatureSet(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static FeatureSet of(Map<String, ?> defaults, Map<String, ?> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>();
        putAll(merged, defaults);
        putAll(merged, overrides);
        return new FeatureSet(merged);
    }

    public static FeatureSet empty() {
        return new FeatureSet(new LinkedHashMap<>());
    }

    /**
     * Validates and normalises an override map. Returns a new mutable copy.
     */
    public static Map<String, Object> normalize(Map<String, ?> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        putAll(out, raw);
        return out;
    }

    private static void putAll(Map<String, Object> target, Map<String, ?> source) {
        if (source == null) return;
        for (Map.Entry<String, ?> e : source.entrySet()) {
            String name = e.getKey();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("feature name must not be blank");
            }
            target.put(name, normalizeValue(name, e.getValue()));
        }
    }

    static Object normalizeValue(String name, Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger || value instanceof BigDecimal) {
            try {
                return value instanceof BigInteger big ? big.longValueExact() : ((BigDecimal) value).longValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("feature '" + name + "' out of range or not whole: " + value, e);
            }
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("feature '" + name + "' must be a whole number: " + value);
            }
            // 2^63 is the first double above Long.MAX_VALUE
            if (d < -0x1p63 || d >= 0x1p63) {
                throw new IllegalArgumentException("feature '" + name + "' out of range: " + value);
            }
            return (long) d;
        }
        throw new IllegalArgumentException("feature '" + name + "' must be boolean or integer, got: " + value);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object value(String name) {
        return values.get(name);
    }

    /**
     * True for Boolean.TRUE or any non-zero limit (-1 means unlimited).
     */
    public boolean isEnabled(String name) {
        Object v = values.get(name);
        if (v instanceof Boolean b) return b;
        if (v instanceof Long l) return l != 0L;
        return false;
    }

    /**
     * Numeric limit for an enabled numeric feature, otherwise null.
     */
    public Long limit(String name) {
        Object v = values.get(name);
        if (v instanceof Long l && l != 0L) return l;
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSet other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "FeatureSet" + values;
    }
}
