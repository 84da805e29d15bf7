package com.edareport.analyzer.exception;

/** The supplied table is malformed, e.g. its columns have different lengths. */
public class InputShapeException extends ReportGenerationException {

  public InputShapeException(String message) {
    super(PipelineStage.INPUT_VALIDATION, message);
  }
}
