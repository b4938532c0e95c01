package com.licensor.api.license;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.licensor.api.metrics.LicenseMetrics;
import com.licensor.api.token.LicenseTokenAuthority;
import com.licensor.api.token.LicenseTokenAuthority.VerifiedLicense;
import com.licensor.api.token.TokenVerification;
import com.licensor.application.service.ActivationResult;
import com.licensor.application.service.FeatureCheck;
import com.licensor.application.service.LicenseValidationService;
import com.licensor.application.service.ValidationResult;
import com.licensor.domain.device.DeviceInfo;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Client-facing license operations. The license key in the body is the credential.
 */
@RestController
@RequestMapping(value = "/api/v1/licenses", produces = MediaType.APPLICATION_JSON_VALUE)
public class LicenseController {

  private final LicenseValidationService licenses;
  private final LicenseTokenAuthority tokenAuthority;
  private final LicenseMetrics metrics;

  public LicenseController(LicenseValidationService licenses, LicenseTokenAuthority tokenAuthority, LicenseMetrics metrics) {
    this.licenses = licenses;
    this.tokenAuthority = tokenAuthority;
    this.metrics = metrics;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DeviceInfoRequest(
      @Size(max = 100) String deviceName,
      @Size(max = 50) String deviceType,
      @Size(max = 500) String fingerprint,
      @Size(max = 50) String osName,
      @Size(max = 50) String osVersion,
      @Size(max = 20) String appVersion
  ) {
    DeviceInfo toDeviceInfo() {
      return new DeviceInfo(deviceName, deviceType, fingerprint, osName, osVersion, appVersion);
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ActivateRequest(
      @NotBlank @Size(max = 100) String licenseKey,
      @NotBlank @Size(max = 100) String deviceId,
      @Valid DeviceInfoRequest deviceInfo
  ) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ValidateRequest(
      @NotBlank @Size(max = 100) String licenseKey,
      @NotBlank @Size(max = 100) String deviceId,
      Boolean updateLastSeen
  ) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DeactivateRequest(
      @NotBlank @Size(max = 100) String licenseKey,
      @NotBlank @Size(max = 100) String deviceId
  ) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record FeatureRequest(
      @NotBlank @Size(max = 100) String licenseKey,
      @NotBlank @Size(max = 100) String featureName
  ) {}

  public record VerifyTokenRequest(@NotBlank String token) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ActivateResponse(
      String action,
      String message,
      String token,
      String tokenId,
      Instant tokenExpiresAt,
      UUID subscriptionId,
      String deviceId,
      String tier,
      Map<String, Object> features,
      Instant expiresAt,
      boolean inGracePeriod,
      Integer daysUntilExpiry
  ) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ValidateResponse(
      boolean valid,
      String reason,
      String message,
      UUID subscriptionId,
      String tier,
      String status,
      Map<String, Object> features,
      Instant expiresAt,
      Boolean inGracePeriod,
      Integer daysUntilExpiry
  ) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DeactivateResponse(boolean deactivated, String deviceId, String message) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record FeatureResponse(String feature, boolean enabled, Long limit, String tier) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record VerifyTokenResponse(
      boolean valid,
      String outcome,
      UUID subscriptionId,
      UUID customerId,
      String tier,
      Map<String, Object> features,
      String deviceId,
      Instant expiresAt,
      Integer gracePeriodDays,
      String tokenId,
      Instant issuedAt,
      Instant tokenExpiresAt
  ) {}

  @PostMapping("/activate")
  public ActivateResponse activate(@Valid @RequestBody ActivateRequest req) {
    DeviceInfo info = req.deviceInfo() == null ? DeviceInfo.empty() : req.deviceInfo().toDeviceInfo();
    ActivationResult r = licenses.activate(req.licenseKey(), req.deviceId(), info);
    metrics.incActivation(r.action().wireName());
    return new ActivateResponse(
        r.action().wireName(),
        r.message(),
        r.token().token(),
        r.token().tokenId(),
        r.token().expiresAt(),
        r.subscriptionId(),
        r.deviceId(),
        r.tier().wireName(),
        r.features(),
        r.expiresAt(),
        r.inGracePeriod(),
        r.daysUntilExpiry()
    );
  }

  /**
   * Always 200: a refused license is a normal answer here, not an error.
   */
  @PostMapping("/validate")
  public ValidateResponse validate(@Valid @RequestBody ValidateRequest req) {
    boolean touch = req.updateLastSeen() == null || req.updateLastSeen();
    ValidationResult r = licenses.validate(req.licenseKey(), req.deviceId(), touch);
    metrics.incValidation(r.valid() ? "valid" : r.reason().wireName());
    return new ValidateResponse(
        r.valid(),
        r.reason() == null ? null : r.reason().wireName(),
        r.message(),
        r.subscriptionId(),
        r.tier() == null ? null : r.tier().wireName(),
        r.status() == null ? null : r.status().name().toLowerCase(Locale.ROOT),
        r.features(),
        r.expiresAt(),
        r.valid() ? r.inGracePeriod() : null,
        r.daysUntilExpiry()
    );
  }

  @PostMapping("/deactivate")
  public DeactivateResponse deactivate(@Valid @RequestBody DeactivateRequest req) {
    boolean found = licenses.deactivate(req.licenseKey(), req.deviceId());
    return new DeactivateResponse(found, req.deviceId(),
        found ? "Device deactivated successfully" : "Device not found for this license");
  }

  @PostMapping("/check-feature")
  public FeatureResponse checkFeature(@Valid @RequestBody FeatureRequest req) {
    FeatureCheck c = licenses.checkFeature(req.licenseKey(), req.featureName());
    return new FeatureResponse(c.feature(), c.enabled(), c.limit(), c.tier().wireName());
  }

  @PostMapping("/verify-token")
  public VerifyTokenResponse verifyToken(@Valid @RequestBody VerifyTokenRequest req) {
    TokenVerification<VerifiedLicense> v = tokenAuthority.verify(req.token());
    if (!v.isValid()) {
      return new VerifyTokenResponse(false, v.outcome().wireName(),
          null, null, null, null, null, null, null, null, null, null);
    }
    VerifiedLicense l = v.payload();
    return new VerifyTokenResponse(
        true,
        v.outcome().wireName(),
        l.claims().subscriptionId(),
        l.claims().customerId(),
        l.claims().tier().wireName(),
        l.claims().features(),
        l.claims().deviceId(),
        l.claims().expiresAt(),
        l.claims().gracePeriodDays(),
        l.tokenId(),
        l.issuedAt(),
        l.tokenExpiresAt()
    );
  }
}
