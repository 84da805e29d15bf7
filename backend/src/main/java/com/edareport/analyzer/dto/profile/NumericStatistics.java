package com.edareport.analyzer.dto.profile;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Descriptive statistics of a numeric column. A {@code null} field means "not applicable". */
@Value
@Builder
public class NumericStatistics {

  long count;
  Double min;
  Double max;
  Double mean;
  Double standardDeviation;
  @Singular List<QuantileValue> quantiles;
}
