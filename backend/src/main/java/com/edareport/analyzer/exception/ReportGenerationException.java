package com.edareport.analyzer.exception;

/** Fatal failure of a report run. No partial document is produced when this is thrown. */
public class ReportGenerationException extends RuntimeException {

  private final PipelineStage stage;

  public ReportGenerationException(PipelineStage stage, String message) {
    super(message);
    this.stage = stage;
  }

  public ReportGenerationException(PipelineStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public PipelineStage getStage() {
    return stage;
  }
}
