package com.edareport.analyzer.exception;

public class ReportAssemblyException extends ReportGenerationException {

  public ReportAssemblyException(String message, Throwable cause) {
    super(PipelineStage.ASSEMBLY, message, cause);
  }
}
