package com.aoimapper.analyzer.pipeline;

/** Raised when no usable imagery exists for the requested AOI and date window. */
public class DataUnavailableException extends AnalysisException {
  public DataUnavailableException(String message) {
    super(message);
  }

  public DataUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public AnalysisErrorKind kind() {
    return AnalysisErrorKind.DATA_UNAVAILABLE;
  }
}
