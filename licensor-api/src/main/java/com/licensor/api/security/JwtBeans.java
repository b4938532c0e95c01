package com.licensor.api.security;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.List;

import com.licensor.api.config.LicensingProperties;
import com.licensor.api.token.TokenExpiryValidator;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.JWSAlgorithm;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;

/**
 * Operator (dashboard) token beans: HS256 encoder/decoder over a secret derived from
 * {@code licensor.operator.token-secret}. The decoder is what the resource server uses for /api/v1/admin/**.
 */
@Configuration
public class JwtBeans {

  static final String OPERATOR_KEY_ID = "licensor-operator-hs256";

  private final Environment env;

  public JwtBeans(Environment env) {
    this.env = env;
  }

  @Bean
  public PasswordEncoder passwordEncoder() {
    return PasswordEncoderFactories.createDelegatingPasswordEncoder();
  }

  @Bean
  public JwtEncoder jwtEncoder(LicensingProperties props) {
    byte[] keyBytes = normalizeSecret(props.operator().tokenSecret());
    var jwk = new OctetSequenceKey.Builder(keyBytes)
        .algorithm(JWSAlgorithm.HS256)
        .keyID(OPERATOR_KEY_ID)
        .build();

    JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
    return new NimbusJwtEncoder(jwkSource);
  }

  @Bean
  public JwtDecoder jwtDecoder(LicensingProperties props, Clock clock) {
    var key = new SecretKeySpec(normalizeSecret(props.operator().tokenSecret()), "HmacSHA256");
    NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();

    String issuer = props.operator().issuer();
    decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
        new TokenExpiryValidator(clock),
        new JwtIssuerValidator(issuer),
        new JwtClaimValidator<List<String>>("aud", aud -> aud != null && aud.contains(issuer))
    ));
    return decoder;
  }

  /**
   * Any configured secret string is hashed to a fixed 32-byte HS256 key.
   * A blank secret is only tolerated in the dev profile.
   */
  private byte[] normalizeSecret(String secret) {
    String s = (secret == null) ? "" : secret.trim();
    if (s.isEmpty()) {
      if (env.acceptsProfiles(Profiles.of("dev"))) {
        s = "dev-operator-secret-change-me";
      } else {
        throw new IllegalStateException("licensor.operator.token-secret is empty. Set LICENSOR_OPERATOR_TOKEN_SECRET.");
      }
    }

    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return md.digest(s.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
