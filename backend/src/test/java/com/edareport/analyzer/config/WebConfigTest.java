package com.edareport.analyzer.config;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import com.edareport.analyzer.controller.ReportController;
import com.edareport.analyzer.service.ReportGenerationService;
import com.edareport.analyzer.service.data_processing.ColumnTypeInferenceService;
import com.edareport.analyzer.service.storage.ReportStorageService;

@WebMvcTest(ReportController.class)
class WebConfigTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ReportGenerationService reportGenerationService;

  @MockitoBean private ColumnTypeInferenceService typeInferenceService;

  @MockitoBean private ReportStorageService reportStorageService;

  @MockitoBean private ApplicationProperties applicationProperties;

  @Test
  void shouldRedirectRootToApiDocs() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().is3xxRedirection())
        .andExpect(redirectedUrl("/swagger-ui/index.html"));
  }

  @Test
  void shouldExposeReportHeadersToBrowsers() throws Exception {
    mockMvc
        .perform(
            options("/api/health")
                .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000"));
  }
}
