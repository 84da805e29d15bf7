package com.edareport.analyzer.dto.profile;

import lombok.Value;

@Value
public class QuantileValue {

  /** Percentile in (0, 100]. */
  double percent;

  /** {@code null} when the column has no non-missing values. */
  Double value;
}
