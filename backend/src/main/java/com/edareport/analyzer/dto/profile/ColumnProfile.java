package com.edareport.analyzer.dto.profile;

import com.edareport.analyzer.dto.table.ColumnType;

import lombok.Builder;
import lombok.Value;

/**
 * Per-column result bundle. Exactly one of {@link #numeric} and {@link #categorical} is set for
 * analyzed columns; both are {@code null} for unsupported columns and failed profiles.
 */
@Value
@Builder
public class ColumnProfile {

  String columnName;
  ColumnType columnType;
  ColumnClass columnClass;
  long rowCount;
  long nonMissingCount;
  long missingCount;
  NumericStatistics numeric;
  CategoricalStatistics categorical;
  String note;

  public boolean isAnalyzed() {
    return numeric != null || categorical != null;
  }
}
