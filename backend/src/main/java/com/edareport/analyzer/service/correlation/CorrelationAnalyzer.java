package com.edareport.analyzer.service.correlation;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.util.FastMath;
import org.springframework.stereotype.Service;

import com.edareport.analyzer.dto.profile.ChartArtifact;
import com.edareport.analyzer.dto.profile.CorrelationMatrix;
import com.edareport.analyzer.dto.profile.CorrelationResult;
import com.edareport.analyzer.dto.table.DataColumn;
import com.edareport.analyzer.exception.ChartRenderingException;
import com.edareport.analyzer.service.rendering.HeatmapRenderer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pairwise Pearson correlation over numeric columns. Each pair uses only the rows where both
 * cells are present. Coefficients that cannot be computed (fewer than two complete rows, zero
 * variance) are left undefined.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrelationAnalyzer {

  private final HeatmapRenderer heatmapRenderer;

  public CorrelationResult analyze(List<DataColumn> numericColumns) {
    int n = numericColumns.size();
    if (n < 2) {
      log.debug("Skipping correlation: {} numeric column(s)", n);
      return CorrelationResult.insufficient(n);
    }

    double[][] coefficients = new double[n][n];
    for (int i = 0; i < n; i++) {
      coefficients[i][i] = hasVariance(numericColumns.get(i)) ? 1.0 : Double.NaN;
      for (int j = i + 1; j < n; j++) {
        double r = pearson(numericColumns.get(i), numericColumns.get(j));
        coefficients[i][j] = r;
        coefficients[j][i] = r;
      }
    }

    List<String> names =
        numericColumns.stream().map(DataColumn::getName).collect(Collectors.toList());
    CorrelationMatrix matrix = new CorrelationMatrix(names, coefficients);

    try {
      ChartArtifact heatmap = heatmapRenderer.render(matrix);
      return CorrelationResult.computed(matrix, heatmap);
    } catch (ChartRenderingException e) {
      log.warn("Correlation heatmap omitted: {}", e.getMessage());
      return CorrelationResult.withoutHeatmap(matrix, "Heatmap omitted: " + e.getMessage());
    }
  }

  /** Pearson coefficient over pairwise-complete rows, or {@code NaN} when undefined. */
  double pearson(DataColumn first, DataColumn second) {
    int rows = first.size();
    double[] xs = new double[rows];
    double[] ys = new double[rows];
    int complete = 0;
    for (int row = 0; row < rows; row++) {
      if (first.isMissing(row) || second.isMissing(row)) {
        continue;
      }
      xs[complete] = ((Number) first.get(row)).doubleValue();
      ys[complete] = ((Number) second.get(row)).doubleValue();
      complete++;
    }
    if (complete < 2) {
      return Double.NaN;
    }

    double[] x = Arrays.copyOf(xs, complete);
    double[] y = Arrays.copyOf(ys, complete);
    if (StatUtils.variance(x) == 0.0 || StatUtils.variance(y) == 0.0) {
      return Double.NaN;
    }

    double r = new PearsonsCorrelation().correlation(x, y);
    if (!Double.isFinite(r)) {
      return Double.NaN;
    }
    return FastMath.max(-1.0, FastMath.min(1.0, r));
  }

  private boolean hasVariance(DataColumn column) {
    double[] values = column.numericValues();
    if (values.length < 2) {
      return false;
    }
    double variance = StatUtils.variance(values);
    return Double.isFinite(variance) && variance > 0.0;
  }
}
