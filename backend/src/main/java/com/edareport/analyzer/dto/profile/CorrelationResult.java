package com.edareport.analyzer.dto.profile;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of correlation analysis. Having fewer than two numeric columns is a valid terminal
 * state, not an error.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CorrelationResult {

  public enum Status {
    COMPUTED,
    INSUFFICIENT_NUMERIC_COLUMNS
  }

  Status status;
  int numericColumnCount;
  CorrelationMatrix matrix;
  ChartArtifact heatmap;
  String heatmapNote;

  public static CorrelationResult insufficient(int numericColumnCount) {
    return new CorrelationResult(
        Status.INSUFFICIENT_NUMERIC_COLUMNS, numericColumnCount, null, null, null);
  }

  public static CorrelationResult computed(CorrelationMatrix matrix, ChartArtifact heatmap) {
    return new CorrelationResult(Status.COMPUTED, matrix.size(), matrix, heatmap, null);
  }

  public static CorrelationResult withoutHeatmap(CorrelationMatrix matrix, String heatmapNote) {
    return new CorrelationResult(Status.COMPUTED, matrix.size(), matrix, null, heatmapNote);
  }

  public boolean isComputed() {
    return status == Status.COMPUTED;
  }
}
