package com.licensor.api.tracing;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Correlation id for every HTTP request.
 *
 * - taken from X-Request-Id (or X-Correlation-Id) when present and sane, otherwise a new UUID
 * - put in MDC (key "requestId") and RequestContext
 * - echoed in the X-Request-Id response header
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

  public static final String HDR_REQUEST_ID = "X-Request-Id";
  public static final String MDC_REQUEST_ID = "requestId";

  private static final int MAX_LENGTH = 128;

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String reqId = firstNonBlank(request.getHeader(HDR_REQUEST_ID), request.getHeader("X-Correlation-Id"));
    if (reqId == null) reqId = UUID.randomUUID().toString();

    MDC.put(MDC_REQUEST_ID, reqId);
    RequestContext.set(reqId);
    response.setHeader(HDR_REQUEST_ID, reqId);

    try {
      filterChain.doFilter(request, response);
    } finally {
      RequestContext.clear();
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  private static String firstNonBlank(String a, String b) {
    String v = (a != null && !a.isBlank()) ? a.trim() : (b != null && !b.isBlank()) ? b.trim() : null;
    if (v == null || v.length() > MAX_LENGTH) return null;
    for (int i = 0; i < v.length(); i++) {
      char c = v.charAt(i);
      if (Character.isISOControl(c)) return null;
    }
    return v;
  }
}
