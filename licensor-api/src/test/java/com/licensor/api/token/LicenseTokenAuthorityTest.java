package com.licensor.api.token;

import com.licensor.api.token.LicenseTokenAuthority.VerifiedLicense;
import com.licensor.application.ports.LicenseClaims;
import com.licensor.application.ports.LicenseTokenIssuer.IssuedToken;
import com.licensor.domain.subscription.SubscriptionTier;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.PlainJWT;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class LicenseTokenAuthorityTest {

  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private static KeyPair keys;

  @BeforeAll
  static void generateKeys() throws Exception {
    KeyPairGenerator gen = KeyPairGenerator.getInstance("RSA");
    gen.initialize(2048);
    keys = gen.generateKeyPair();
  }

  private static LicenseTokenAuthority authority(Instant now) {
    return authority(now, "licensor-app");
  }

  private static LicenseTokenAuthority authority(Instant now, String audience) {
    return new LicenseTokenAuthority((RSAPublicKey) keys.getPublic(), (RSAPrivateKey) keys.getPrivate(),
        "licensor", audience, Duration.ofDays(30), Clock.fixed(now, ZoneOffset.UTC));
  }

  private static LicenseClaims claims() {
    return new LicenseClaims(
        UUID.randomUUID(),
        UUID.randomUUID(),
        SubscriptionTier.PROFESSIONAL,
        Map.of("max_customers", 1000L, "analytics", true),
        "device-1",
        Instant.parse("2026-06-01T00:00:00Z"),
        7
    );
  }

  @Test
  void issuedTokenVerifiesWithSameClaims() {
    LicenseTokenAuthority authority = authority(T0);
    LicenseClaims claims = claims();

    IssuedToken issued = authority.issue(claims);
    TokenVerification<VerifiedLicense> v = authority.verify(issued.token());

    assertThat(v.outcome()).isEqualTo(TokenVerification.Outcome.VALID);
    assertThat(v.payload().claims()).isEqualTo(claims);
    assertThat(v.payload().tokenId()).isEqualTo(issued.tokenId());
    assertThat(v.payload().issuedAt()).isEqualTo(T0);
    assertThat(v.payload().tokenExpiresAt()).isEqualTo(T0.plus(Duration.ofDays(30)));
    assertThat(issued.expiresAt()).isEqualTo(T0.plus(Duration.ofDays(30)));
  }

  @Test
  void headerIsRs256WithKeyId() throws Exception {
    IssuedToken issued = authority(T0).issue(claims());

    SignedJWT parsed = SignedJWT.parse(issued.token());
    assertThat(parsed.getHeader().getAlgorithm()).isEqualTo(JWSAlgorithm.RS256);
    assertThat(parsed.getHeader().getKeyID()).isEqualTo(LicenseTokenAuthority.KEY_ID);
  }

  @Test
  void neverExpiringSubscriptionRoundTripsWithoutExpiresAt() {
    LicenseClaims c = new LicenseClaims(UUID.randomUUID(), UUID.randomUUID(), SubscriptionTier.ENTERPRISE,
        Map.of("max_customers", -1L), "d", null, 0);
    LicenseTokenAuthority authority = authority(T0);

    TokenVerification<VerifiedLicense> v = authority.verify(authority.issue(c).token());

    assertThat(v.isValid()).isTrue();
    assertThat(v.payload().claims().expiresAt()).isNull();
  }

  @Test
  void tokenPastItsTtlIsExpired() {
    String token = authority(T0).issue(claims()).token();

    TokenVerification<VerifiedLicense> v = authority(T0.plus(Duration.ofDays(31))).verify(token);

    assertThat(v.outcome()).isEqualTo(TokenVerification.Outcome.EXPIRED);
    assertThat(v.outcome().wireName()).isEqualTo("token_expired");
    assertThat(v.payload()).isNull();
  }

  @Test
  void tokenIsStillValidJustBeforeTtl() {
    String token = authority(T0).issue(claims()).token();

    TokenVerification<VerifiedLicense> v = authority(T0.plus(Duration.ofDays(30)).minusSeconds(1)).verify(token);

    assertThat(v.isValid()).isTrue();
  }

  @Test
  void tamperedPayloadIsInvalid() {
    String token = authority(T0).issue(claims()).token();
    String[] parts = token.split("\\.");
    String payload = new String(Base64.getUrlDecoder().decode(parts[1]));
    String forged = payload.replace("\"professional\"", "\"enterprise\"");
    assertThat(forged).isNotEqualTo(payload);
    String tampered = parts[0] + "." + Base64.getUrlEncoder().withoutPadding().encodeToString(forged.getBytes()) + "." + parts[2];

    TokenVerification<VerifiedLicense> v = authority(T0).verify(tampered);

    assertThat(v.outcome()).isEqualTo(TokenVerification.Outcome.INVALID);
    assertThat(v.outcome().wireName()).isEqualTo("token_invalid");
  }

  @Test
  void tokenSignedWithAnotherKeyIsInvalid() throws Exception {
    KeyPairGenerator gen = KeyPairGenerator.getInstance("RSA");
    gen.initialize(2048);
    KeyPair other = gen.generateKeyPair();
    LicenseTokenAuthority foreign = new LicenseTokenAuthority((RSAPublicKey) other.getPublic(),
        (RSAPrivateKey) other.getPrivate(), "licensor", "licensor-app", Duration.ofDays(30),
        Clock.fixed(T0, ZoneOffset.UTC));

    assertThat(authority(T0).verify(foreign.issue(claims()).token()).outcome())
        .isEqualTo(TokenVerification.Outcome.INVALID);
  }

  @Test
  void wrongAudienceIsInvalid() {
    String token = authority(T0, "another-app").issue(claims()).token();

    assertThat(authority(T0).verify(token).outcome()).isEqualTo(TokenVerification.Outcome.INVALID);
  }

  @Test
  void unsignedTokenIsRejected() {
    PlainJWT plain = new PlainJWT(licenseClaimsSet("licensor", "licensor-app"));

    assertThat(authority(T0).verify(plain.serialize()).outcome()).isEqualTo(TokenVerification.Outcome.INVALID);
  }

  @Test
  void hs256TokenIsRejected() throws Exception {
    SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), licenseClaimsSet("licensor", "licensor-app"));
    jwt.sign(new MACSigner(new byte[32]));

    assertThat(authority(T0).verify(jwt.serialize()).outcome()).isEqualTo(TokenVerification.Outcome.INVALID);
  }

  @Test
  void operatorStyleTokenIsRejected() throws Exception {
    SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256),
        new JWTClaimsSet.Builder()
            .issuer("licensor-dashboard")
            .audience("licensor-dashboard")
            .subject("admin")
            .issueTime(Date.from(T0))
            .expirationTime(Date.from(T0.plusSeconds(1800)))
            .claim("role", "ADMIN")
            .build());
    jwt.sign(new MACSigner("0123456789abcdef0123456789abcdef".getBytes()));

    assertThat(authority(T0).verify(jwt.serialize()).isValid()).isFalse();
  }

  @Test
  void garbageAndBlankAreInvalid() {
    LicenseTokenAuthority authority = authority(T0);

    assertThat(authority.verify("not-a-token").outcome()).isEqualTo(TokenVerification.Outcome.INVALID);
    assertThat(authority.verify("  ").outcome()).isEqualTo(TokenVerification.Outcome.INVALID);
    assertThat(authority.verify(null).outcome()).isEqualTo(TokenVerification.Outcome.INVALID);
  }

  private static JWTClaimsSet licenseClaimsSet(String issuer, String audience) {
    return new JWTClaimsSet.Builder()
        .issuer(issuer)
        .audience(List.of(audience))
        .issueTime(Date.from(T0))
        .expirationTime(Date.from(T0.plusSeconds(3600)))
        .claim("subscription_id", UUID.randomUUID().toString())
        .claim("customer_id", UUID.randomUUID().toString())
        .claim("tier", "enterprise")
        .claim("device_id", "device-1")
        .claim("grace_period_days", 7)
        .build();
  }
}
