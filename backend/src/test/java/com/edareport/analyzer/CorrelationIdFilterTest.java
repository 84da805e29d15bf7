package com.edareport.analyzer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

class CorrelationIdFilterTest {

  private CorrelationIdFilter filter;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;
  private AtomicReference<String> seenInChain;

  @BeforeEach
  void setUp() {
    filter = new CorrelationIdFilter();
    request = new MockHttpServletRequest("POST", "/api/report/table");
    response = new MockHttpServletResponse();
    seenInChain = new AtomicReference<>();
  }

  @Test
  void shouldReuseClientCorrelationId() throws Exception {
    request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "client-run.42");

    filter.doFilter(request, response, recordingChain());

    assertThat(seenInChain.get()).isEqualTo("client-run.42");
    assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
        .isEqualTo("client-run.42");
    assertThat(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }

  @Test
  void shouldGenerateIdWhenHeaderIsAbsent() throws Exception {
    filter.doFilter(request, response, recordingChain());

    assertThat(seenInChain.get()).isNotBlank();
    assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
        .isEqualTo(seenInChain.get());
  }

  @ParameterizedTest
  @ValueSource(strings = {"bad id", "line\nbreak", "<script>"})
  void shouldReplaceUnsafeIds(String header) throws Exception {
    request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, header);

    filter.doFilter(request, response, recordingChain());

    assertThat(seenInChain.get()).isNotEqualTo(header).matches("[0-9a-f-]{36}");
  }

  @Test
  void shouldReplaceOverlongIds() throws Exception {
    request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "a".repeat(65));

    filter.doFilter(request, response, recordingChain());

    assertThat(seenInChain.get()).hasSize(36);
  }

  private MockFilterChain recordingChain() {
    return new MockFilterChain(
        new HttpServlet() {
          @Override
          protected void service(HttpServletRequest req, HttpServletResponse resp) {
            seenInChain.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
          }
        });
  }
}
