package com.edareport.analyzer.dto.report;

import lombok.Builder;
import lombok.Value;

/** The terminal artifact of a run: the HTML document plus a few facts about how it was made. */
@Value
@Builder
public class GeneratedReport {

  String tableName;
  String html;
  int rowCount;
  int columnCount;
  int numericColumnCount;
  int omittedChartCount;
  long processingTimeMs;
  String outputPath;
}
