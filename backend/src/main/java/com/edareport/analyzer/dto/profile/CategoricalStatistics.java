package com.edareport.analyzer.dto.profile;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Frequencies of a categorical column, most frequent first. When the number of distinct values
 * exceeds the configured cap, the tail is folded into {@link #otherBucket}.
 */
@Value
@Builder
public class CategoricalStatistics {

  public static final String OTHER_LABEL = "Other";

  long count;
  int distinctCount;
  String topValue;
  Long topFrequency;
  @Singular List<CategoryFrequency> categories;
  CategoryFrequency otherBucket;
  int otherDistinctCount;

  public boolean hasOtherBucket() {
    return otherBucket != null;
  }
}
