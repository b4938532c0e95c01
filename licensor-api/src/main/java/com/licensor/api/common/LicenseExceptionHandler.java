package com.licensor.api.common;

import com.licensor.api.metrics.LicenseMetrics;
import com.licensor.domain.DomainException;
import com.licensor.domain.device.DeviceLimitExceededException;
import com.licensor.domain.device.DeviceNotFoundException;
import com.licensor.domain.license.LicenseKeyInvalidException;
import com.licensor.domain.subscription.IllegalSubscriptionTransitionException;
import com.licensor.domain.subscription.SubscriptionExpiredException;
import com.licensor.domain.subscription.SubscriptionInactiveException;
import com.licensor.domain.subscription.SubscriptionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Business-rule violations. These are expected outcomes: logged at WARN, never ERROR.
 */
@RestControllerAdvice
public class LicenseExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(LicenseExceptionHandler.class);

  private final Clock clock;
  private final LicenseMetrics metrics;

  public LicenseExceptionHandler(Clock clock, LicenseMetrics metrics) {
    this.clock = clock;
    this.metrics = metrics;
  }

  @ExceptionHandler(DomainException.class)
  public ResponseEntity<Map<String, Object>> handle(DomainException ex) {
    HttpStatus status = statusOf(ex);
    log.warn("Request rejected code={} status={} details={}", ex.errorCode(), status.value(), ex.details());
    metrics.incRejection(ex.errorCode());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "error");
    body.put("reason", ex.errorCode().toLowerCase(Locale.ROOT));
    body.put("message", ex.getMessage());
    if (!ex.details().isEmpty()) {
      body.put("details", ex.details());
    }
    body.put("ts", clock.instant().toString());
    return ResponseEntity.status(status).body(body);
  }

  static HttpStatus statusOf(DomainException ex) {
    if (ex instanceof LicenseKeyInvalidException) return HttpStatus.UNAUTHORIZED;
    if (ex instanceof SubscriptionExpiredException) return HttpStatus.FORBIDDEN;
    if (ex instanceof SubscriptionInactiveException) return HttpStatus.FORBIDDEN;
    if (ex instanceof DeviceLimitExceededException) return HttpStatus.CONFLICT;
    if (ex instanceof IllegalSubscriptionTransitionException) return HttpStatus.CONFLICT;
    if (ex instanceof SubscriptionNotFoundException) return HttpStatus.NOT_FOUND;
    if (ex instanceof DeviceNotFoundException) return HttpStatus.NOT_FOUND;
    return HttpStatus.BAD_REQUEST;
  }
}
