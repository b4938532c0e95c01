package com.licensor.api.tracing;

/**
 * Per-request correlation id held in a ThreadLocal, for code that writes it somewhere other than logs
 * (the audit log).
 */
public final class RequestContext {

  private static final ThreadLocal<String> REQUEST_ID = new ThreadLocal<>();

  private RequestContext() {}

  public static void set(String requestId) {
    REQUEST_ID.set(requestId);
  }

  public static void clear() {
    REQUEST_ID.remove();
  }

  public static String requestId() {
    return REQUEST_ID.get();
  }
}
