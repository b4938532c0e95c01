package com.licensor.api.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * License traffic counters.
 *
 * Exposes:
 * - licensor.license.activations{action}
 * - licensor.license.validations{result}
 * - licensor.license.rejections{code}
 */
@Component
public class LicenseMetrics {

  private final MeterRegistry registry;

  public LicenseMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  public void incActivation(String action) {
    Counter.builder("licensor.license.activations")
        .description("Successful activate calls by action")
        .tag("action", tagValue(action))
        .register(registry)
        .increment();
  }

  public void incValidation(String result) {
    Counter.builder("licensor.license.validations")
        .description("Validate calls by result")
        .tag("result", tagValue(result))
        .register(registry)
        .increment();
  }

  public void incRejection(String errorCode) {
    Counter.builder("licensor.license.rejections")
        .description("Requests refused with a business error")
        .tag("code", tagValue(errorCode))
        .register(registry)
        .increment();
  }

  private static String tagValue(String v) {
    return v == null || v.isBlank() ? "unknown" : v.toLowerCase(Locale.ROOT);
  }
}
