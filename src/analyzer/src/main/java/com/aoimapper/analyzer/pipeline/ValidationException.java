package com.aoimapper.analyzer.pipeline;

/** Raised when an AOI request violates an input constraint. */
public class ValidationException extends AnalysisException {
  public ValidationException(String message) {
    super(message);
  }

  @Override
  public AnalysisErrorKind kind() {
    return AnalysisErrorKind.VALIDATION;
  }
}
