package com.edareport.analyzer.dto.profile;

import lombok.Value;

@Value
public class ColumnMissingCount {
  String columnName;
  long missingCount;
}
