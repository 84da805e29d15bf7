package com.edareport.analyzer.exception;

/**
 * A single chart could not be produced. Recovered locally: the affected section omits its chart
 * and the run continues.
 */
public class ChartRenderingException extends Exception {

  public ChartRenderingException(String message) {
    super(message);
  }

  public ChartRenderingException(String message, Throwable cause) {
    super(message, cause);
  }
}
