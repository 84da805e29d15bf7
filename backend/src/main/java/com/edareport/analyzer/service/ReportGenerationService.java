package com.edareport.analyzer.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.edareport.analyzer.config.ApplicationProperties;
import com.edareport.analyzer.dto.profile.ChartArtifact;
import com.edareport.analyzer.dto.profile.ColumnClass;
import com.edareport.analyzer.dto.profile.ColumnProfile;
import com.edareport.analyzer.dto.profile.ColumnReport;
import com.edareport.analyzer.dto.profile.CorrelationResult;
import com.edareport.analyzer.dto.profile.DatasetSummary;
import com.edareport.analyzer.dto.report.GeneratedReport;
import com.edareport.analyzer.dto.report.ReportOptions;
import com.edareport.analyzer.dto.table.DataColumn;
import com.edareport.analyzer.dto.table.DataTable;
import com.edareport.analyzer.exception.ChartRenderingException;
import com.edareport.analyzer.exception.PipelineStage;
import com.edareport.analyzer.exception.ReportGenerationException;
import com.edareport.analyzer.service.assembly.ReportAssembler;
import com.edareport.analyzer.service.correlation.CorrelationAnalyzer;
import com.edareport.analyzer.service.profiling.ColumnClassifier;
import com.edareport.analyzer.service.profiling.ColumnProfiler;
import com.edareport.analyzer.service.rendering.DistributionRenderer;
import com.edareport.analyzer.service.storage.FileReportSink;
import com.edareport.analyzer.service.summary.DatasetSummarizer;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the report pipeline over one table: classify, profile and chart every column, correlate
 * the numeric columns, summarize the table, then assemble the HTML document.
 *
 * <p>Failures confined to one column (a profiling error, a chart that cannot be drawn) are logged
 * and noted in that column's section; the rest of the report is still produced. Anything else is
 * fatal and surfaces as a {@link ReportGenerationException} naming the failed stage.
 */
@Slf4j
@Service
public class ReportGenerationService {

  static final String CHART_OMITTED_PREFIX = "Chart omitted: ";

  private final ColumnClassifier columnClassifier;
  private final ColumnProfiler columnProfiler;
  private final DistributionRenderer distributionRenderer;
  private final CorrelationAnalyzer correlationAnalyzer;
  private final DatasetSummarizer datasetSummarizer;
  private final ReportAssembler reportAssembler;
  private final FileReportSink fileReportSink;
  private final ApplicationProperties applicationProperties;
  private final Executor taskExecutor;

  public ReportGenerationService(
      ColumnClassifier columnClassifier,
      ColumnProfiler columnProfiler,
      DistributionRenderer distributionRenderer,
      CorrelationAnalyzer correlationAnalyzer,
      DatasetSummarizer datasetSummarizer,
      ReportAssembler reportAssembler,
      FileReportSink fileReportSink,
      ApplicationProperties applicationProperties,
      @Qualifier("taskExecutor") Executor taskExecutor) {
    this.columnClassifier = columnClassifier;
    this.columnProfiler = columnProfiler;
    this.distributionRenderer = distributionRenderer;
    this.correlationAnalyzer = correlationAnalyzer;
    this.datasetSummarizer = datasetSummarizer;
    this.reportAssembler = reportAssembler;
    this.fileReportSink = fileReportSink;
    this.applicationProperties = applicationProperties;
    this.taskExecutor = taskExecutor;
  }

  public GeneratedReport generateReport(DataTable table, ReportOptions options) {
    long startTime = System.currentTimeMillis();
    options.validate();

    log.info(
        "Starting report generation for table: {} with {} columns and {} rows",
        table.getName(),
        table.getColumnCount(),
        table.getRowCount());

    List<ColumnClass> classes = new ArrayList<>(table.getColumnCount());
    List<DataColumn> numericColumns = new ArrayList<>();
    for (DataColumn column : table.getColumns()) {
      ColumnClass columnClass = columnClassifier.classify(column);
      classes.add(columnClass);
      if (columnClass == ColumnClass.NUMERIC) {
        numericColumns.add(column);
      }
    }

    List<ColumnReport> columnReports = analyzeColumns(table, classes, options);
    List<ColumnProfile> profiles = new ArrayList<>(columnReports.size());
    int omittedCharts = 0;
    for (ColumnReport columnReport : columnReports) {
      profiles.add(columnReport.getProfile());
      if (columnReport.isChartOmitted()) {
        omittedCharts++;
      }
    }

    CorrelationResult correlation =
        runStage(PipelineStage.CORRELATION, () -> correlationAnalyzer.analyze(numericColumns));
    DatasetSummary summary =
        runStage(PipelineStage.SUMMARY, () -> datasetSummarizer.summarize(table, profiles));

    String html = reportAssembler.assemble(options.getTitle(), summary, columnReports, correlation);
    String writtenTo = persist(options.getOutputPath(), html);

    long processingTime = System.currentTimeMillis() - startTime;
    log.info(
        "Report for table {} completed in {} ms ({} numeric columns, {} charts omitted)",
        table.getName(),
        processingTime,
        numericColumns.size(),
        omittedCharts);

    return GeneratedReport.builder()
        .tableName(table.getName())
        .html(html)
        .rowCount(table.getRowCount())
        .columnCount(table.getColumnCount())
        .numericColumnCount(numericColumns.size())
        .omittedChartCount(omittedCharts)
        .processingTimeMs(processingTime)
        .outputPath(writtenTo)
        .build();
  }

  private List<ColumnReport> analyzeColumns(
      DataTable table, List<ColumnClass> classes, ReportOptions options) {
    int columnCount = table.getColumnCount();
    ApplicationProperties.Parallel parallel = applicationProperties.getParallel();

    if (!parallel.isEnabled() || columnCount < Math.max(2, parallel.getMinColumns())) {
      List<ColumnReport> reports = new ArrayList<>(columnCount);
      for (int i = 0; i < columnCount; i++) {
        reports.add(analyzeColumn(i, table.getColumn(i), classes.get(i), options));
      }
      return reports;
    }

    log.debug("Analyzing {} columns in parallel", columnCount);
    Map<String, String> context = MDC.getCopyOfContextMap();
    List<CompletableFuture<ColumnReport>> futures = new ArrayList<>(columnCount);
    List<ColumnReport> reports = new ArrayList<>(columnCount);
    try {
      for (int i = 0; i < columnCount; i++) {
        int index = i;
        futures.add(
            CompletableFuture.supplyAsync(
                () ->
                    withContext(
                        context,
                        () ->
                            analyzeColumn(
                                index, table.getColumn(index), classes.get(index), options)),
                taskExecutor));
      }

      // joined in submission order so sections keep the table's column order
      for (CompletableFuture<ColumnReport> future : futures) {
        reports.add(future.join());
      }
    } catch (RejectedExecutionException e) {
      futures.forEach(future -> future.cancel(true));
      throw new ReportGenerationException(
          PipelineStage.PROFILING,
          "Column analysis could not be scheduled after "
              + futures.size()
              + " of "
              + columnCount
              + " columns: "
              + e.getMessage(),
          e);
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new ReportGenerationException(
          PipelineStage.PROFILING, "Column analysis failed: " + cause.getMessage(), cause);
    }
    return reports;
  }

  ColumnReport analyzeColumn(
      int index, DataColumn column, ColumnClass columnClass, ReportOptions options) {
    ColumnProfile profile;
    try {
      profile = columnProfiler.profile(column, columnClass, options);
    } catch (RuntimeException e) {
      log.warn("Profiling failed for column '{}': {}", column.getName(), e.getMessage(), e);
      profile = failedProfile(column, columnClass, e);
    }

    ColumnReport.ColumnReportBuilder builder = ColumnReport.builder().index(index).profile(profile);
    if (!profile.isAnalyzed()) {
      return builder.build();
    }

    try {
      Optional<ChartArtifact> chart = distributionRenderer.render(profile, column, options);
      chart.ifPresent(builder::chart);
    } catch (ChartRenderingException e) {
      log.warn("Chart omitted for column '{}': {}", column.getName(), e.getMessage());
      builder.chartNote(CHART_OMITTED_PREFIX + e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Chart rendering failed for column '{}'", column.getName(), e);
      builder.chartNote(CHART_OMITTED_PREFIX + "unexpected rendering error");
    }
    return builder.build();
  }

  private ColumnProfile failedProfile(
      DataColumn column, ColumnClass columnClass, RuntimeException cause) {
    long missing = column.missingCount();
    return ColumnProfile.builder()
        .columnName(column.getName())
        .columnType(column.getType())
        .columnClass(columnClass)
        .rowCount(column.size())
        .missingCount(missing)
        .nonMissingCount(column.size() - missing)
        .note("Profiling failed: " + cause.getMessage())
        .build();
  }

  private String persist(String outputPath, String html) {
    if (outputPath == null || outputPath.isBlank()) {
      return null;
    }
    if (!fileReportSink.isEnabled()) {
      log.info("Report persistence is disabled; not writing {}", outputPath);
      return null;
    }
    try {
      Path written = fileReportSink.write(outputPath, html);
      return written.toString();
    } catch (IOException e) {
      throw new ReportGenerationException(
          PipelineStage.PERSISTENCE, "Failed to write report to " + outputPath, e);
    }
  }

  private <T> T runStage(PipelineStage stage, Supplier<T> step) {
    try {
      return step.get();
    } catch (ReportGenerationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ReportGenerationException(
          stage, "Failed during " + stage.getLabel() + ": " + e.getMessage(), e);
    }
  }

  private static <T> T withContext(Map<String, String> context, Supplier<T> task) {
    if (context != null) {
      MDC.setContextMap(context);
    }
    try {
      return task.get();
    } finally {
      MDC.clear();
    }
  }
}
