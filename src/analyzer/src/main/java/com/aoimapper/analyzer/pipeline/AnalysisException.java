package com.aoimapper.analyzer.pipeline;

/**
 * Base class of every failure the pipeline reports.
 *
 * <p>Each subclass fixes its {@link AnalysisErrorKind}; the message is the human-readable
 * reason returned to the caller.
 */
public abstract class AnalysisException extends RuntimeException {
  protected AnalysisException(String message) {
    super(message);
  }

  protected AnalysisException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract AnalysisErrorKind kind();
}
