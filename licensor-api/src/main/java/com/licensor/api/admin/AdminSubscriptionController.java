package com.licensor.api.admin;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.licensor.application.service.CreateSubscriptionCommand;
import com.licensor.application.service.SubscriptionLifecycleService;
import com.licensor.domain.subscription.Subscription;
import com.licensor.domain.subscription.SubscriptionTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/subscriptions")
public class AdminSubscriptionController {

  private final SubscriptionLifecycleService subscriptions;
  private final AdminAuditService audit;
  private final Clock clock;

  public AdminSubscriptionController(SubscriptionLifecycleService subscriptions, AdminAuditService audit, Clock clock) {
    this.subscriptions = subscriptions;
    this.audit = audit;
    this.clock = clock;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record CreateRequest(
      @NotNull UUID customerId,
      @NotBlank String tier,
      @Min(1) @Max(3650) Integer durationDays,
      @Min(1) @Max(100) Integer maxDevices,
      @Min(0) @Max(90) Integer gracePeriodDays,
      Map<String, Object> featureOverrides
  ) {}

  public record ExtendRequest(@NotNull @Min(1) @Max(3650) Integer days) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record TierRequest(@NotBlank String tier, Map<String, Object> featureOverrides) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record LimitsRequest(
      @NotNull @Min(1) @Max(100) Integer maxDevices,
      @NotNull @Min(0) @Max(90) Integer gracePeriodDays
  ) {}

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public SubscriptionView create(@AuthenticationPrincipal Jwt jwt, @Valid @RequestBody CreateRequest req) {
    CreateSubscriptionCommand cmd = new CreateSubscriptionCommand(
        req.customerId(),
        SubscriptionTier.parse(req.tier()),
        req.durationDays(),
        req.maxDevices() == null ? 1 : req.maxDevices(),
        req.gracePeriodDays(),
        req.featureOverrides()
    );
    return view(audit.audited(operator(jwt), "SUBSCRIPTION_CREATE",
        () -> subscriptions.create(cmd), s -> "tier=" + s.tier().wireName()));
  }

  @GetMapping("/{id}")
  public SubscriptionView get(@PathVariable UUID id) {
    return view(subscriptions.get(id));
  }

  @GetMapping
  public List<SubscriptionView> listForCustomer(@RequestParam UUID customerId) {
    return subscriptions.listForCustomer(customerId).stream().map(this::view).toList();
  }

  @PostMapping("/{id}/suspend")
  public SubscriptionView suspend(@AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    return view(audit.audited(operator(jwt), "SUBSCRIPTION_SUSPEND", () -> subscriptions.suspend(id), s -> null));
  }

  @PostMapping("/{id}/cancel")
  public SubscriptionView cancel(@AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    return view(audit.audited(operator(jwt), "SUBSCRIPTION_CANCEL", () -> subscriptions.cancel(id), s -> null));
  }

  @PostMapping("/{id}/resume")
  public SubscriptionView resume(@AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    return view(audit.audited(operator(jwt), "SUBSCRIPTION_RESUME",
        () -> subscriptions.resume(id), s -> "activeDevices=" + s.activeDeviceCount()));
  }

  @PostMapping("/{id}/extend")
  public SubscriptionView extend(@AuthenticationPrincipal Jwt jwt, @PathVariable UUID id,
                                 @Valid @RequestBody ExtendRequest req) {
    return view(audit.audited(operator(jwt), "SUBSCRIPTION_EXTEND",
        () -> subscriptions.extend(id, req.days()), s -> "days=" + req.days()));
  }

  @PutMapping("/{id}/tier")
  public SubscriptionView updateTier(@AuthenticationPrincipal Jwt jwt, @PathVariable UUID id,
                                     @Valid @RequestBody TierRequest req) {
    SubscriptionTier tier = SubscriptionTier.parse(req.tier());
    return view(audit.audited(operator(jwt), "SUBSCRIPTION_TIER",
        () -> subscriptions.updateTier(id, tier, req.featureOverrides()), s -> "tier=" + s.tier().wireName()));
  }

  @PutMapping("/{id}/limits")
  public SubscriptionView changeLimits(@AuthenticationPrincipal Jwt jwt, @PathVariable UUID id,
                                       @Valid @RequestBody LimitsRequest req) {
    return view(audit.audited(operator(jwt), "SUBSCRIPTION_LIMITS",
        () -> subscriptions.changeLimits(id, req.maxDevices(), req.gracePeriodDays()),
        s -> "maxDevices=" + req.maxDevices() + ",gracePeriodDays=" + req.gracePeriodDays()));
  }

  @DeleteMapping("/{id}/devices/{deviceId}")
  public SubscriptionView releaseDevice(@AuthenticationPrincipal Jwt jwt, @PathVariable UUID id,
                                        @PathVariable String deviceId) {
    return view(audit.audited(operator(jwt), "DEVICE_RELEASE",
        () -> subscriptions.releaseDevice(id, deviceId), s -> "deviceId=" + deviceId));
  }

  private SubscriptionView view(Subscription s) {
    return SubscriptionView.of(s, clock.instant());
  }

  private static String operator(Jwt jwt) {
    return jwt == null ? null : jwt.getSubject();
  }
}
