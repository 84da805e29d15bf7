package com.edareport.analyzer.dto.profile;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class DatasetSummary {

  int rowCount;
  int columnCount;
  long duplicateRowCount;
  long totalMissingCount;
  @Singular List<ColumnMissingCount> missingCounts;
}
