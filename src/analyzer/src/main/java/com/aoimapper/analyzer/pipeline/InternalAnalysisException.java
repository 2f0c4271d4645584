package com.aoimapper.analyzer.pipeline;

/** Raised when classification, vectorization or aggregation breaks an invariant. */
public class InternalAnalysisException extends AnalysisException {
  public InternalAnalysisException(String message) {
    super(message);
  }

  public InternalAnalysisException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public AnalysisErrorKind kind() {
    return AnalysisErrorKind.INTERNAL;
  }
}
