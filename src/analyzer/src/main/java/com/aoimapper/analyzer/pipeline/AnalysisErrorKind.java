package com.aoimapper.analyzer.pipeline;

/** Stable failure kinds surfaced to callers of the analysis pipeline. */
public enum AnalysisErrorKind {
  /** Malformed or out-of-range input. Not retried. */
  VALIDATION("validation_error"),
  /** No qualifying imagery for the AOI and date window. */
  DATA_UNAVAILABLE("data_unavailable"),
  /** The imagery fetch exceeded the caller's bound or the run was cancelled. */
  TIMEOUT("timeout"),
  /** A pipeline invariant was violated. Always fatal to the request. */
  INTERNAL("internal_error");

  private final String code;

  AnalysisErrorKind(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
