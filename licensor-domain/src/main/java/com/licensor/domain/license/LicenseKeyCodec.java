package com.licensor.domain.license;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Objects;

/**
 * Generates and format-checks license keys of the shape {@code PREFIX-XXXXXX-XXXXXX-XXXXXX-XXXXXX}.
 *
 * Format validation is a cheap pre-check before a storage lookup. A well-formed key may still be unknown.
 */
public final class LicenseKeyCodec {

    public static final String DEFAULT_PREFIX = "FL";
    public static final int DEFAULT_SEGMENT_LENGTH = 6;
    public static final int MIN_SEGMENT_LENGTH = 4;

    private static final int SEGMENTS = 4;
    private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

    private final String prefix;
    private final int segmentLength;
    private final SecureRandom random;

    public LicenseKeyCodec() {
        this(DEFAULT_PREFIX, DEFAULT_SEGMENT_LENGTH, new SecureRandom());
    }

    public LicenseKeyCodec(String prefix, int segmentLength) {
        this(prefix, segmentLength, new SecureRandom());
    }

    public LicenseKeyCodec(String prefix, int segmentLength, SecureRandom random) {
        if (prefix == null || prefix.isBlank() || prefix.contains("-")) {
            throw new IllegalArgumentException("prefix must be non-blank and must not contain '-'");
        }
        if (segmentLength < MIN_SEGMENT_LENGTH) {
            throw new IllegalArgumentException("segmentLength must be >= " + MIN_SEGMENT_LENGTH);
        }
        this.prefix = prefix.toUpperCase(Locale.ROOT);
        this.segmentLength = segmentLength;
        this.random = Objects.requireNonNull(random, "random");
    }

    public String generate() {
        StringBuilder sb = new StringBuilder(prefix.length() + SEGMENTS * (segmentLength + 1));
        sb.append(prefix);
        for (int s = 0; s < SEGMENTS; s++) {
            sb.append('-');
            for (int i = 0; i < segmentLength; i++) {
                sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
            }
        }
        return sb.toString();
    }

    public boolean validateFormat(String key) {
        if (key == null || key.isEmpty()) return false;

        String[] parts = key.split("-", -1);
        if (parts.length != SEGMENTS + 1) return false;
        if (!prefix.equals(parts[0])) return false;

        for (int i = 1; i < parts.length; i++) {
            String part = parts[i];
            if (part.length() < MIN_SEGMENT_LENGTH) return false;
            for (int c = 0; c < part.length(); c++) {
                if (!isKeyChar(part.charAt(c))) return false;
            }
        }
        return true;
    }

    /**
     * Log-safe form: first 8 characters followed by {@code ***}.
     */
    public static String mask(String key) {
        if (key == null) return "null";
        if (key.length() <= 8) return "***";
        return key.substring(0, 8) + "***";
    }

    public String prefix() { return prefix; }
    public int segmentLength() { return segmentLength; }

    // same alphabet generate() draws from; lowercase is not folded
    private static boolean isKeyChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
