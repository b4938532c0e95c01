package com.licensor.application.service;

import java.util.Locale;

/**
 * Why a validation came back negative.
 */
public enum ValidationReason {
    INVALID_LICENSE_KEY,
    DEVICE_NOT_ACTIVATED,
    EXPIRED,
    INACTIVE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
