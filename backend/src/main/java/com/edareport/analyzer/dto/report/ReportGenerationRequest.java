package com.edareport.analyzer.dto.report;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportGenerationRequest {

  @JsonProperty("table_name")
  private String tableName;

  @NotNull
  @NotEmpty
  @JsonProperty("columns")
  private List<String> columns;

  @Schema(description = "Declared type per column name; columns left out are inferred")
  @JsonProperty("column_types")
  private Map<String, String> columnTypes;

  @NotNull
  @JsonProperty("data")
  private List<Map<String, Object>> data;

  @Min(1)
  @JsonProperty("max_categories")
  private Integer maxCategories;

  @JsonProperty("histogram_bins")
  private Integer histogramBins;

  @JsonProperty("output_path")
  private String outputPath;

  @JsonProperty("title")
  private String title;
}
