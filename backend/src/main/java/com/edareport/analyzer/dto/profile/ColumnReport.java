package com.edareport.analyzer.dto.profile;

import lombok.Builder;
import lombok.Value;

/** A column's profile with its optional chart, ready for assembly. */
@Value
@Builder
public class ColumnReport {

  int index;
  ColumnProfile profile;
  ChartArtifact chart;

  /** Why {@link #chart} is absent, or {@code null} when a chart was produced. */
  String chartNote;

  public boolean isChartOmitted() {
    return chart == null && chartNote != null;
  }
}
