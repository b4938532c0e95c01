package com.licensor.api.token;

import com.licensor.application.ports.LicenseClaims;
import com.licensor.application.ports.LicenseTokenIssuer;
import com.licensor.domain.feature.FeatureSet;
import com.licensor.domain.subscription.SubscriptionTier;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.SignatureAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Signs and verifies license tokens (RS256).
 *
 * Token lifetime is a fixed ceiling ({@code ttl}) and has nothing to do with the subscription's own
 * expiry. Verification accepts RS256 only; HS256 and unsigned tokens are rejected, as are tokens
 * with another issuer or audience (operator tokens included).
 */
public class LicenseTokenAuthority implements LicenseTokenIssuer {

  static final String KEY_ID = "licensor-rs256";

  private final JwtEncoder encoder;
  private final NimbusJwtDecoder decoder;
  private final String issuer;
  private final String audience;
  private final Duration ttl;
  private final Clock clock;

  public LicenseTokenAuthority(RSAPublicKey publicKey,
                               RSAPrivateKey privateKey,
                               String issuer,
                               String audience,
                               Duration ttl,
                               Clock clock) {
    Objects.requireNonNull(publicKey, "publicKey");
    Objects.requireNonNull(privateKey, "privateKey");
    this.issuer = Objects.requireNonNull(issuer, "issuer");
    this.audience = Objects.requireNonNull(audience, "audience");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");

    RSAKey jwk = new RSAKey.Builder(publicKey)
        .privateKey(privateKey)
        .keyID(KEY_ID)
        .build();
    JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
    this.encoder = new NimbusJwtEncoder(jwkSource);

    this.decoder = NimbusJwtDecoder.withPublicKey(publicKey)
        .signatureAlgorithm(SignatureAlgorithm.RS256)
        .build();
    this.decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
        new TokenExpiryValidator(clock),
        new JwtIssuerValidator(issuer),
        new JwtClaimValidator<List<String>>("aud", aud -> aud != null && aud.contains(audience))
    ));
  }

  public static LicenseTokenAuthority fromKeys(RsaKeyStore.LoadedKeys keys, String issuer, String audience,
                                               Duration ttl, Clock clock) {
    return new LicenseTokenAuthority(keys.publicKey(), keys.privateKey(), issuer, audience, ttl, clock);
  }

  @Override
  public IssuedToken issue(LicenseClaims claims) {
    Instant now = clock.instant();
    Instant exp = now.plus(ttl);
    String jti = UUID.randomUUID().toString();

    JwtClaimsSet.Builder b = JwtClaimsSet.builder()
        .issuer(issuer)
        .audience(List.of(audience))
        .subject(claims.subscriptionId().toString())
        .issuedAt(now)
        .expiresAt(exp)
        .id(jti)
        .claim("subscription_id", claims.subscriptionId().toString())
        .claim("customer_id", claims.customerId().toString())
        .claim("tier", claims.tier().wireName())
        .claim("features", claims.features())
        .claim("device_id", claims.deviceId())
        .claim("grace_period_days", claims.gracePeriodDays());
    // absent claim = subscription never expires
    if (claims.expiresAt() != null) {
      b.claim("expires_at", claims.expiresAt().toString());
    }

    JwsHeader header = JwsHeader.with(SignatureAlgorithm.RS256).keyId(KEY_ID).build();
    String token = encoder.encode(JwtEncoderParameters.from(header, b.build())).getTokenValue();
    return new IssuedToken(token, jti, now, exp);
  }

  public TokenVerification<VerifiedLicense> verify(String token) {
    return TokenVerification.verify(decoder, token, LicenseTokenAuthority::toVerified);
  }

  public String issuer() { return issuer; }
  public String audience() { return audience; }
  public Duration ttl() { return ttl; }

  private static VerifiedLicense toVerified(Jwt jwt) {
    String expiresAt = jwt.getClaimAsString("expires_at");
    Object grace = jwt.getClaim("grace_period_days");
    Map<String, Object> features = jwt.getClaimAsMap("features");

    LicenseClaims claims = new LicenseClaims(
        UUID.fromString(required(jwt, "subscription_id")),
        UUID.fromString(required(jwt, "customer_id")),
        SubscriptionTier.parse(required(jwt, "tier")),
        FeatureSet.normalize(features),
        required(jwt, "device_id"),
        expiresAt == null ? null : Instant.parse(expiresAt),
        grace instanceof Number n ? n.intValue() : 0
    );
    return new VerifiedLicense(claims, jwt.getId(), jwt.getIssuedAt(), jwt.getExpiresAt());
  }

  private static String required(Jwt jwt, String claim) {
    String v = jwt.getClaimAsString(claim);
    if (v == null || v.isBlank()) {
      throw new IllegalArgumentException("missing claim: " + claim);
    }
    return v;
  }

  /**
   * @param tokenExpiresAt token ceiling, not the subscription expiry (that is in {@code claims})
   */
  public record VerifiedLicense(LicenseClaims claims, String tokenId, Instant issuedAt, Instant tokenExpiresAt) {}
}
