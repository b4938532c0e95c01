package com.licensor.api.token;

import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Rejects tokens without {@code exp} or past it, judged against the injected clock.
 * Expiry gets its own error code so callers can tell it apart from other failures.
 */
public final class TokenExpiryValidator implements OAuth2TokenValidator<Jwt> {

  public static final String ERROR_CODE = "token_expired";

  private final Clock clock;

  public TokenExpiryValidator(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public OAuth2TokenValidatorResult validate(Jwt jwt) {
    Instant exp = jwt.getExpiresAt();
    if (exp == null) {
      return OAuth2TokenValidatorResult.failure(new OAuth2Error("invalid_token", "exp claim is required", null));
    }
    if (clock.instant().isAfter(exp)) {
      return OAuth2TokenValidatorResult.failure(new OAuth2Error(ERROR_CODE, "Token expired at " + exp, null));
    }
    return OAuth2TokenValidatorResult.success();
  }
}
