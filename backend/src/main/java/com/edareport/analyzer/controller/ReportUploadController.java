package com.edareport.analyzer.controller;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.edareport.analyzer.config.ApplicationProperties;
import com.edareport.analyzer.dto.report.GeneratedReport;
import com.edareport.analyzer.dto.report.ReportOptions;
import com.edareport.analyzer.dto.table.DataTable;
import com.edareport.analyzer.service.ReportGenerationService;
import com.edareport.analyzer.service.data_processing.CsvParsingService;
import com.edareport.analyzer.service.storage.ReportStorageService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "File Upload", description = "Generate a report from an uploaded CSV file")
public class ReportUploadController {

  public static final String REPORT_ID_HEADER = "X-Report-Id";

  @Value("${app.upload.max-file-size:10485760}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:csv}")
  private Set<String> allowedExtensions;

  private final ReportGenerationService reportGenerationService;
  private final CsvParsingService csvParsingService;
  private final ReportStorageService reportStorageService;
  private final ApplicationProperties applicationProperties;

  @PostMapping(
      value = "/report/analyze",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Generate report from file",
      description = "Profile an uploaded CSV file and return a self-contained HTML report")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Report generated",
            content = @Content(mediaType = MediaType.TEXT_HTML_VALUE)),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file or request",
            content = @Content),
        @ApiResponse(
            responseCode = "500",
            description = "Report generation failed",
            content = @Content)
      })
  public ResponseEntity<String> analyzeFile(
      @Parameter(description = "CSV file with a header row", required = true)
          @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "Most frequent values shown per categorical column")
          @RequestParam(value = "maxCategories", required = false)
          Integer maxCategories,
      @Parameter(description = "Number of histogram bins for numeric columns")
          @RequestParam(value = "histogramBins", required = false)
          Integer histogramBins,
      @Parameter(description = "File to write the report to, relative to the report directory")
          @RequestParam(value = "outputPath", required = false)
          String outputPath,
      @Parameter(description = "Report title")
          @RequestParam(value = "title", required = false)
          String title)
      throws IOException {

    validateFile(file);
    String fileName = file.getOriginalFilename();

    DataTable table = csvParsingService.parseCsv(file.getInputStream(), fileName);
    ReportOptions options =
        applicationProperties.toOptions(maxCategories, histogramBins, title, outputPath);

    GeneratedReport report = reportGenerationService.generateReport(table, options);
    String reportId = reportStorageService.storeReport(report);
    log.info("Stored report with ID: {} for file: {}", reportId, fileName);

    return ResponseEntity.ok()
        .contentType(ReportController.HTML_UTF8)
        .header(REPORT_ID_HEADER, reportId)
        .body(report.getHtml());
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = extractFileExtension(fileName);
    if (!allowedExtensions.contains(extension.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException(
          "File type not supported. Allowed types: " + allowedExtensions);
    }
  }

  private String extractFileExtension(String fileName) {
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1);
  }
}
