package com.edareport.analyzer.controller;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import com.edareport.analyzer.config.ApplicationProperties;
import com.edareport.analyzer.dto.report.GeneratedReport;
import com.edareport.analyzer.dto.report.ReportOptions;
import com.edareport.analyzer.dto.table.DataTable;
import com.edareport.analyzer.fixtures.TestTables;
import com.edareport.analyzer.service.ReportGenerationService;
import com.edareport.analyzer.service.data_processing.CsvParsingService;
import com.edareport.analyzer.service.storage.ReportStorageService;

@WebMvcTest(ReportUploadController.class)
@DisplayName("Report Upload Controller Tests")
class ReportUploadControllerTest {

  @Autowired private MockMvc mockMvc;

  @Autowired private ApplicationContext applicationContext;

  @MockitoBean private ReportGenerationService reportGenerationService;

  @MockitoBean private CsvParsingService csvParsingService;

  @MockitoBean private ReportStorageService reportStorageService;

  @MockitoBean private ApplicationProperties applicationProperties;

  @BeforeEach
  void setUp() {
    ReportUploadController controller = applicationContext.getBean(ReportUploadController.class);
    ReflectionTestUtils.setField(controller, "allowedExtensions", Set.of("csv"));
    ReflectionTestUtils.setField(controller, "maxFileSize", 1024L);
  }

  @Test
  @DisplayName("Should turn an uploaded CSV into an HTML report")
  void shouldAnalyzeCsvFile() throws Exception {
    // Given
    MockMultipartFile csvFile = csv("people.csv", "age,city\n23,A\n27,B");
    DataTable table = TestTables.ageAndCity();
    ReportOptions options = ReportOptions.defaults();
    GeneratedReport report =
        GeneratedReport.builder().tableName("people").html("<html>people</html>").build();

    when(csvParsingService.parseCsv(any(InputStream.class), eq("people.csv"))).thenReturn(table);
    when(applicationProperties.toOptions(7, null, "People", null)).thenReturn(options);
    when(reportGenerationService.generateReport(table, options)).thenReturn(report);
    when(reportStorageService.storeReport(report)).thenReturn("report-42");

    // When & Then
    mockMvc
        .perform(
            multipart("/api/report/analyze")
                .file(csvFile)
                .param("maxCategories", "7")
                .param("title", "People"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
        .andExpect(header().string(ReportUploadController.REPORT_ID_HEADER, "report-42"))
        .andExpect(content().string(containsString("people")));

    verify(reportGenerationService).generateReport(table, options);
  }

  @Test
  @DisplayName("Should reject an empty file")
  void shouldRejectEmptyFile() throws Exception {
    mockMvc
        .perform(multipart("/api/report/analyze").file(csv("empty.csv", "")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("File is empty"));

    verify(csvParsingService, never()).parseCsv(any(), any());
  }

  @Test
  @DisplayName("Should reject unsupported file types")
  void shouldRejectUnsupportedFileType() throws Exception {
    mockMvc
        .perform(multipart("/api/report/analyze").file(csv("notes.txt", "a,b\n1,2")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value(containsString("File type not supported")));

    verify(csvParsingService, never()).parseCsv(any(), any());
  }

  @Test
  @DisplayName("Should accept upper-case extensions under any default locale")
  void shouldAcceptUpperCaseExtension() throws Exception {
    Locale original = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      DataTable table = TestTables.ageAndCity();
      ReportOptions options = ReportOptions.defaults();
      GeneratedReport report =
          GeneratedReport.builder().tableName("people").html("<html>people</html>").build();
      when(csvParsingService.parseCsv(any(InputStream.class), eq("PEOPLE.CSV"))).thenReturn(table);
      when(applicationProperties.toOptions(null, null, null, null)).thenReturn(options);
      when(reportGenerationService.generateReport(table, options)).thenReturn(report);
      when(reportStorageService.storeReport(report)).thenReturn("report-7");

      mockMvc
          .perform(multipart("/api/report/analyze").file(csv("PEOPLE.CSV", "age,city\n23,A")))
          .andExpect(status().isOk());

      verify(csvParsingService).parseCsv(any(InputStream.class), eq("PEOPLE.CSV"));
    } finally {
      Locale.setDefault(original);
    }
  }

  @Test
  @DisplayName("Should reject files over the size limit")
  void shouldRejectOversizedFile() throws Exception {
    String content = "value\n" + "1\n".repeat(600);

    mockMvc
        .perform(multipart("/api/report/analyze").file(csv("big.csv", content)))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.message")
                .value("File size exceeds maximum allowed size of 1024 bytes"));
  }

  @Test
  @DisplayName("Should report parse errors as bad request")
  void shouldReportParseErrors() throws Exception {
    when(csvParsingService.parseCsv(any(InputStream.class), eq("blank.csv")))
        .thenThrow(new IllegalArgumentException("CSV file has no headers"));

    mockMvc
        .perform(multipart("/api/report/analyze").file(csv("blank.csv", "\n")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("CSV file has no headers"));
  }

  @Test
  @DisplayName("Should require the file part")
  void shouldRequireFilePart() throws Exception {
    mockMvc.perform(multipart("/api/report/analyze")).andExpect(status().isBadRequest());
  }

  private static MockMultipartFile csv(String fileName, String content) {
    return new MockMultipartFile(
        "file", fileName, "text/csv", content.getBytes(StandardCharsets.UTF_8));
  }
}
