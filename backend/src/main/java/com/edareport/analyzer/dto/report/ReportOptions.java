package com.edareport.analyzer.dto.report;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Parameters of one report run. */
@Value
@Builder(toBuilder = true)
public class ReportOptions {

  public static final int DEFAULT_MAX_CATEGORIES = 10;
  public static final int DEFAULT_HISTOGRAM_BINS = 20;
  public static final String DEFAULT_TITLE = "Data Analysis Report";

  @Builder.Default int maxCategories = DEFAULT_MAX_CATEGORIES;
  @Builder.Default int histogramBins = DEFAULT_HISTOGRAM_BINS;
  @Singular List<Double> quantiles;
  @Builder.Default String title = DEFAULT_TITLE;

  /** Where the caller will persist the report. Informational for the pipeline itself. */
  String outputPath;

  public static ReportOptions defaults() {
    return ReportOptions.builder().quantile(25.0).quantile(50.0).quantile(75.0).build();
  }

  public void validate() {
    if (maxCategories < 1) {
      throw new IllegalArgumentException("max_categories must be at least 1");
    }
    for (Double quantile : quantiles) {
      if (quantile == null || !(quantile > 0.0 && quantile <= 100.0)) {
        throw new IllegalArgumentException(
            "Quantiles must be percentages in (0, 100], got " + quantile);
      }
    }
  }
}
