package com.licensor.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base type for business-rule violations raised by the licensing core.
 *
 * The error code is a stable, machine-readable identifier (e.g. DEVICE_LIMIT_EXCEEDED);
 * details carry the structured values a client needs to render a message.
 */
public abstract class DomainException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    protected DomainException(String errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    protected DomainException(String errorCode, String message, Map<String, ?> details) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details == null ? Map.of() : details));
    }

    public String errorCode() {
        return errorCode;
    }

    public Map<String, Object> details() {
        return details;
    }
}
