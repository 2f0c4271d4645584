package com.aoimapper.analyzer.pipeline;

/** Raised when the run deadline passes or the run is cancelled by its caller. */
public class AnalysisTimeoutException extends AnalysisException {
  public AnalysisTimeoutException(String message) {
    super(message);
  }

  public AnalysisTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public AnalysisErrorKind kind() {
    return AnalysisErrorKind.TIMEOUT;
  }
}
