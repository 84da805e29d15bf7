package com.edareport.analyzer.service.storage;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.edareport.analyzer.dto.report.GeneratedReport;
import com.edareport.analyzer.exception.ResourceNotFoundException;
import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/** In-memory store of generated reports, keyed by a random report id. */
@Slf4j
@Service
public class ReportStorageService {

  private final Map<String, StoredReport> reportStorage = new ConcurrentHashMap<>();

  @Data
  public static class StoredReport {
    private String reportId;
    private String tableName;
    private LocalDateTime timestamp;
    private int rowCount;
    private int columnCount;
    private int numericColumnCount;
    private int omittedChartCount;
    private long processingTimeMs;
    private String outputPath;

    @JsonIgnore private String html;
  }

  public String storeReport(GeneratedReport report) {
    String reportId = UUID.randomUUID().toString();

    StoredReport stored = new StoredReport();
    stored.setReportId(reportId);
    stored.setTableName(report.getTableName());
    stored.setTimestamp(LocalDateTime.now());
    stored.setRowCount(report.getRowCount());
    stored.setColumnCount(report.getColumnCount());
    stored.setNumericColumnCount(report.getNumericColumnCount());
    stored.setOmittedChartCount(report.getOmittedChartCount());
    stored.setProcessingTimeMs(report.getProcessingTimeMs());
    stored.setOutputPath(report.getOutputPath());
    stored.setHtml(report.getHtml());

    reportStorage.put(reportId, stored);
    log.info("Stored report {} for table {}", reportId, report.getTableName());
    return reportId;
  }

  public StoredReport getReport(String reportId) {
    StoredReport stored = reportStorage.get(reportId);
    if (stored == null) {
      throw new ResourceNotFoundException("Report not found: " + reportId);
    }
    return stored;
  }

  /** Stored reports, oldest first. */
  public List<StoredReport> getAllReports() {
    List<StoredReport> reports = new ArrayList<>(reportStorage.values());
    reports.sort(Comparator.comparing(StoredReport::getTimestamp));
    return reports;
  }

  public void clearReports() {
    reportStorage.clear();
    log.info("Cleared all stored reports");
  }

  public boolean deleteReport(String reportId) {
    StoredReport removed = reportStorage.remove(reportId);
    if (removed != null) {
      log.info("Deleted report {} for table {}", reportId, removed.getTableName());
      return true;
    }
    log.warn("Report not found for deletion: {}", reportId);
    return false;
  }
}
