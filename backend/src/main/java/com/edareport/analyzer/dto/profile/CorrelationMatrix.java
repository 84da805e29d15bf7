package com.edareport.analyzer.dto.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Square, symmetric matrix of Pearson coefficients over numeric columns. A coefficient that
 * cannot be computed (too few complete pairs, zero variance) is reported as {@code null}.
 */
@ToString
@EqualsAndHashCode
public final class CorrelationMatrix {

  private final List<String> columnNames;
  private final double[][] coefficients;

  public CorrelationMatrix(List<String> columnNames, double[][] coefficients) {
    if (coefficients.length != columnNames.size()) {
      throw new IllegalArgumentException("Matrix dimension does not match column count");
    }
    this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
    this.coefficients = new double[coefficients.length][];
    for (int i = 0; i < coefficients.length; i++) {
      if (coefficients[i].length != columnNames.size()) {
        throw new IllegalArgumentException("Correlation matrix must be square");
      }
      this.coefficients[i] = coefficients[i].clone();
    }
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public int size() {
    return columnNames.size();
  }

  public Double get(int row, int column) {
    double value = coefficients[row][column];
    return Double.isNaN(value) ? null : value;
  }

  /** Looks a coefficient up by name; the first column with a matching name wins. */
  public Double get(String rowColumn, String column) {
    int row = columnNames.indexOf(rowColumn);
    int col = columnNames.indexOf(column);
    if (row < 0 || col < 0) {
      throw new IllegalArgumentException(
          "Unknown numeric column: " + (row < 0 ? rowColumn : column));
    }
    return get(row, col);
  }
}
