package com.licensor.api.token;

import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtValidationException;

import java.time.DateTimeException;
import java.util.Collection;
import java.util.Locale;
import java.util.function.Function;

/**
 * Typed result of checking a token. Expected failures are values, not exceptions.
 */
public record TokenVerification<T>(Outcome outcome, T payload, String detail) {

  public enum Outcome {
    VALID,
    /** Signature, issuer and audience were fine but the token is past its expiry. */
    EXPIRED,
    /** Bad signature, wrong algorithm, wrong issuer/audience, malformed. */
    INVALID;

    public String wireName() {
      return switch (this) {
        case VALID -> "valid";
        case EXPIRED -> "token_expired";
        case INVALID -> "token_invalid";
      };
    }
  }

  public static <T> TokenVerification<T> valid(T payload) {
    return new TokenVerification<>(Outcome.VALID, payload, null);
  }

  public static <T> TokenVerification<T> expired(String detail) {
    return new TokenVerification<>(Outcome.EXPIRED, null, detail);
  }

  public static <T> TokenVerification<T> invalid(String detail) {
    return new TokenVerification<>(Outcome.INVALID, null, detail);
  }

  public boolean isValid() {
    return outcome == Outcome.VALID;
  }

  /**
   * Decodes with {@code decoder} and maps the claims. A token whose only validation failures are
   * expiry errors is EXPIRED; anything else the decoder or mapper rejects is INVALID.
   */
  static <T> TokenVerification<T> verify(JwtDecoder decoder, String token, Function<Jwt, T> mapper) {
    if (token == null || token.isBlank()) {
      return invalid("empty token");
    }
    try {
      Jwt jwt = decoder.decode(token.trim());
      return valid(mapper.apply(jwt));
    } catch (JwtValidationException e) {
      if (onlyExpiry(e.getErrors())) {
        return expired(e.getMessage());
      }
      return invalid(e.getMessage());
    } catch (JwtException | IllegalArgumentException | DateTimeException e) {
      return invalid(e.getMessage());
    }
  }

  private static boolean onlyExpiry(Collection<OAuth2Error> errors) {
    if (errors == null || errors.isEmpty()) return false;
    for (OAuth2Error err : errors) {
      if (!TokenExpiryValidator.ERROR_CODE.equals(err.getErrorCode().toLowerCase(Locale.ROOT))) {
        return false;
      }
    }
    return true;
  }
}
