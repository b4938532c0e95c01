package com.licensor.api.operator;

import com.licensor.api.config.LicensingProperties;
import com.licensor.api.token.OperatorTokenService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.*;

/**
 * Dashboard login for the single configured operator account.
 */
@RestController
@RequestMapping("/api/v1/operator")
public class OperatorAuthController {

  private static final Logger log = LoggerFactory.getLogger(OperatorAuthController.class);

  private final LicensingProperties props;
  private final PasswordEncoder passwordEncoder;
  private final OperatorTokenService tokens;

  public OperatorAuthController(LicensingProperties props, PasswordEncoder passwordEncoder, OperatorTokenService tokens) {
    this.props = props;
    this.passwordEncoder = passwordEncoder;
    this.tokens = tokens;
  }

  public record LoginRequest(
      @NotBlank String username,
      @NotBlank String password
  ) {}

  public record LoginResponse(
      String accessToken,
      String tokenType,
      long expiresInSeconds
  ) {}

  @PostMapping(value = "/login", produces = MediaType.APPLICATION_JSON_VALUE)
  public LoginResponse login(@Valid @RequestBody LoginRequest req) {
    LicensingProperties.Operator operator = props.operator();
    String hash = operator.passwordHash();
    // no configured hash means login is disabled
    boolean ok = hash != null && !hash.isBlank()
        && operator.username().equals(req.username().trim())
        && passwordEncoder.matches(req.password(), hash);
    if (!ok) {
      log.warn("Operator login failed username={}", req.username());
      throw new BadCredentialsException("Invalid username or password");
    }
    var t = tokens.issue(operator.username());
    log.info("Operator login username={}", operator.username());
    return new LoginResponse(t.accessToken(), "Bearer", t.expiresInSeconds());
  }
}
