package com.edareport.analyzer.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.edareport.analyzer.dto.report.ReportOptions;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "report")
public class ApplicationProperties {

  private int maxCategories = ReportOptions.DEFAULT_MAX_CATEGORIES;
  private int histogramBins = ReportOptions.DEFAULT_HISTOGRAM_BINS;
  private List<Double> quantiles = new ArrayList<>(List.of(25.0, 50.0, 75.0));
  private String title = ReportOptions.DEFAULT_TITLE;

  private Parallel parallel = new Parallel();
  private Output output = new Output();

  /**
   * Options for one run: configured defaults, with any non-null argument taking precedence.
   */
  public ReportOptions toOptions(
      Integer maxCategoriesOverride,
      Integer histogramBinsOverride,
      String titleOverride,
      String outputPath) {
    return ReportOptions.builder()
        .maxCategories(maxCategoriesOverride != null ? maxCategoriesOverride : maxCategories)
        .histogramBins(histogramBinsOverride != null ? histogramBinsOverride : histogramBins)
        .quantiles(quantiles)
        .title(titleOverride != null && !titleOverride.isBlank() ? titleOverride : title)
        .outputPath(outputPath)
        .build();
  }

  @Data
  public static class Parallel {
    private boolean enabled;
    private int minColumns = 8;
  }

  @Data
  public static class Output {
    private String directory = "reports";
    private boolean persistEnabled;
  }
}
