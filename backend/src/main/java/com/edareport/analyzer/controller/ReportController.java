package com.edareport.analyzer.controller;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.edareport.analyzer.config.ApplicationProperties;
import com.edareport.analyzer.dto.report.GeneratedReport;
import com.edareport.analyzer.dto.report.ReportGenerationRequest;
import com.edareport.analyzer.dto.report.ReportOptions;
import com.edareport.analyzer.dto.table.DataTable;
import com.edareport.analyzer.service.ReportGenerationService;
import com.edareport.analyzer.service.data_processing.ColumnTypeInferenceService;
import com.edareport.analyzer.service.storage.ReportStorageService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Reports", description = "Exploratory data analysis reports")
public class ReportController {

  static final MediaType HTML_UTF8 = new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8);

  private final ReportGenerationService reportGenerationService;
  private final ColumnTypeInferenceService typeInferenceService;
  private final ReportStorageService reportStorageService;
  private final ApplicationProperties applicationProperties;

  @PostMapping(
      value = "/report/table",
      consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Generate report from table",
      description =
          "Profile a table sent as column names plus row objects and return a self-contained"
              + " HTML report")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Report generated",
            content = @Content(mediaType = MediaType.TEXT_HTML_VALUE)),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(
            responseCode = "500",
            description = "Report generation failed",
            content = @Content)
      })
  public ResponseEntity<String> generateFromTable(
      @Valid @RequestBody ReportGenerationRequest request) {
    log.info(
        "Received report request for table: {} ({} columns, {} rows)",
        request.getTableName(),
        request.getColumns().size(),
        request.getData().size());

    DataTable table =
        typeInferenceService.buildTable(
            request.getTableName(),
            request.getColumns(),
            request.getData(),
            request.getColumnTypes());
    ReportOptions options =
        applicationProperties.toOptions(
            request.getMaxCategories(),
            request.getHistogramBins(),
            request.getTitle(),
            request.getOutputPath());

    GeneratedReport report = reportGenerationService.generateReport(table, options);
    String reportId = reportStorageService.storeReport(report);
    log.info("Stored report with ID: {} for table: {}", reportId, table.getName());

    return ResponseEntity.ok()
        .contentType(HTML_UTF8)
        .header(ReportUploadController.REPORT_ID_HEADER, reportId)
        .body(report.getHtml());
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the report service is healthy")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }

  @GetMapping("/reports")
  @Operation(
      summary = "List stored reports",
      description = "Metadata of every report generated since startup")
  @ApiResponses(
      value = {@ApiResponse(responseCode = "200", description = "Successfully retrieved reports")})
  public ResponseEntity<List<ReportStorageService.StoredReport>> getAllReports() {
    List<ReportStorageService.StoredReport> reports = reportStorageService.getAllReports();
    log.debug("Retrieved {} stored reports", reports.size());
    return ResponseEntity.ok(reports);
  }

  @GetMapping("/reports/{reportId}")
  @Operation(summary = "Get a stored report", description = "Return a stored report's HTML")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Report found"),
        @ApiResponse(responseCode = "404", description = "Report not found")
      })
  public ResponseEntity<String> getReport(@PathVariable String reportId) {
    ReportStorageService.StoredReport stored = reportStorageService.getReport(reportId);
    return ResponseEntity.ok()
        .contentType(HTML_UTF8)
        .header(ReportUploadController.REPORT_ID_HEADER, reportId)
        .body(stored.getHtml());
  }

  @DeleteMapping("/reports")
  @Operation(summary = "Delete all stored reports", description = "Remove every stored report")
  @ApiResponses(
      value = {@ApiResponse(responseCode = "204", description = "Successfully deleted reports")})
  public ResponseEntity<Void> deleteAllReports() {
    reportStorageService.clearReports();
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/reports/{reportId}")
  @Operation(summary = "Delete a stored report", description = "Remove one stored report")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Successfully deleted the report"),
        @ApiResponse(responseCode = "404", description = "Report not found")
      })
  public ResponseEntity<Void> deleteReport(@PathVariable String reportId) {
    if (reportStorageService.deleteReport(reportId)) {
      return ResponseEntity.noContent().build();
    }
    return ResponseEntity.notFound().build();
  }
}
