package com.licensor.application.ports;

import java.time.Instant;

/**
 * Signs license claims. Implemented by the token authority in the API module.
 */
public interface LicenseTokenIssuer {

    IssuedToken issue(LicenseClaims claims);

    record IssuedToken(String token, String tokenId, Instant issuedAt, Instant expiresAt) {}
}
