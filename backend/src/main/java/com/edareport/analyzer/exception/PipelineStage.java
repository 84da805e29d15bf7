package com.edareport.analyzer.exception;

/** Stages of the report pipeline, used to tell the caller where a fatal failure happened. */
public enum PipelineStage {
  INPUT_VALIDATION("input validation"),
  PROFILING("column profiling"),
  RENDERING("chart rendering"),
  CORRELATION("correlation analysis"),
  SUMMARY("dataset summary"),
  ASSEMBLY("report assembly"),
  PERSISTENCE("report persistence");

  private final String label;

  PipelineStage(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
