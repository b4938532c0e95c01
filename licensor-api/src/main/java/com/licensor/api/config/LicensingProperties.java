package com.licensor.api.config;

import com.licensor.domain.license.LicenseKeyCodec;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Licensing config.
 *
 * Secrets (operator password hash, operator token secret) come from env, never from the yml in the repo.
 */
@ConfigurationProperties(prefix = "licensor")
public record LicensingProperties(

    License license,

    Token token,

    Operator operator

) {

  public LicensingProperties {
    license = license == null ? new License(null, 0, null) : license;
    token = token == null ? new Token(null, null, null, null, null) : token;
    operator = operator == null ? new Operator(null, null, null, null, null) : operator;
  }

  /**
   * License key shape and subscription defaults.
   */
  public record License(
      String keyPrefix,
      int keySegmentLength,
      Integer defaultGracePeriodDays
  ) {
    public License {
      keyPrefix = isBlank(keyPrefix) ? LicenseKeyCodec.DEFAULT_PREFIX : keyPrefix.trim();
      keySegmentLength = keySegmentLength <= 0 ? LicenseKeyCodec.DEFAULT_SEGMENT_LENGTH : keySegmentLength;
      defaultGracePeriodDays = defaultGracePeriodDays == null ? 7 : defaultGracePeriodDays;
    }
  }

  /**
   * RS256 license tokens. The key pair is generated at the given paths on first start.
   */
  public record Token(
      String issuer,
      String audience,
      Duration ttl,
      String privateKeyPath,
      String publicKeyPath
  ) {
    public Token {
      issuer = isBlank(issuer) ? "licensor" : issuer.trim();
      audience = isBlank(audience) ? "licensor-app" : audience.trim();
      ttl = ttl == null ? Duration.ofDays(30) : ttl;
      privateKeyPath = isBlank(privateKeyPath) ? "keys/private_key.pem" : privateKeyPath.trim();
      publicKeyPath = isBlank(publicKeyPath) ? "keys/public_key.pem" : publicKeyPath.trim();
    }
  }

  /**
   * Dashboard operator: single configured account, HS256 access tokens.
   *
   * passwordHash uses the DelegatingPasswordEncoder format, e.g. "{bcrypt}$2a$10$...".
   */
  public record Operator(
      String username,
      String passwordHash,
      String tokenSecret,
      String issuer,
      Duration tokenTtl
  ) {
    public Operator {
      username = isBlank(username) ? "admin" : username.trim();
      issuer = isBlank(issuer) ? "licensor-dashboard" : issuer.trim();
      tokenTtl = tokenTtl == null ? Duration.ofMinutes(30) : tokenTtl;
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
