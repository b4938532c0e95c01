package com.licensor.domain.license;

import com.licensor.domain.DomainException;

import java.util.Map;

public final class LicenseKeyInvalidException extends DomainException {

    public LicenseKeyInvalidException(String reason) {
        super("LICENSE_KEY_INVALID", "License key is invalid: " + reason, Map.of("reason", reason));
    }
}
