package com.licensor.api.token;

import com.licensor.api.config.LicensingProperties;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Issues short-lived operator access tokens (HS256, issuer and audience "licensor-dashboard" by default).
 *
 * The token subject is the operator username; role=ADMIN grants /api/v1/admin/**.
 */
@Service
public class OperatorTokenService {

  private final JwtEncoder jwtEncoder;
  private final JwtDecoder jwtDecoder;
  private final String issuer;
  private final Duration ttl;
  private final Clock clock;

  public OperatorTokenService(JwtEncoder jwtEncoder, JwtDecoder jwtDecoder, LicensingProperties props, Clock clock) {
    this.jwtEncoder = jwtEncoder;
    this.jwtDecoder = jwtDecoder;
    this.issuer = props.operator().issuer();
    this.ttl = props.operator().tokenTtl();
    this.clock = clock;
  }

  public OperatorToken issue(String username) {
    Instant now = clock.instant();
    Instant exp = now.plus(ttl);

    var claims = JwtClaimsSet.builder()
        .issuer(issuer)
        .audience(List.of(issuer))
        .subject(username)
        .issuedAt(now)
        .expiresAt(exp)
        .id(UUID.randomUUID().toString())
        .claim("role", "ADMIN")
        .build();

    JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    return new OperatorToken(token, ttl.toSeconds(), exp);
  }

  /**
   * @return the operator username on success
   */
  public TokenVerification<String> verify(String token) {
    return TokenVerification.verify(jwtDecoder, token, jwt -> {
      String sub = jwt.getSubject();
      if (sub == null || sub.isBlank()) throw new IllegalArgumentException("missing subject");
      return sub;
    });
  }

  public record OperatorToken(String accessToken, long expiresInSeconds, Instant expiresAt) {}
}
