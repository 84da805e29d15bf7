package com.edareport.analyzer;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Tags every request with a correlation id: the client's {@value #CORRELATION_ID_HEADER} header
 * when present, otherwise a fresh one. The id is put in the logging MDC for the duration of the
 * request and echoed back in the response.
 */
@Component
@Order(1)
public class CorrelationIdFilter extends OncePerRequestFilter {

  public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
  public static final String CORRELATION_ID_MDC_KEY = "correlationId";

  private static final int MAX_LENGTH = 64;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String correlationId = sanitize(request.getHeader(CORRELATION_ID_HEADER));
      if (correlationId == null) {
        correlationId = UUID.randomUUID().toString();
      }

      MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      response.setHeader(CORRELATION_ID_HEADER, correlationId);

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CORRELATION_ID_MDC_KEY);
    }
  }

  // Client ids end up in log lines; keep them short and printable.
  private String sanitize(String header) {
    if (header == null || header.isBlank() || header.length() > MAX_LENGTH) {
      return null;
    }
    return header.matches("[A-Za-z0-9._-]+") ? header : null;
  }
}
