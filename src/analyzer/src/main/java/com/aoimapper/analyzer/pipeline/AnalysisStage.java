package com.aoimapper.analyzer.pipeline;

/** States of a single analysis run, in execution order. */
public enum AnalysisStage {
  VALIDATING,
  FETCHING_IMAGERY,
  CLASSIFYING,
  VECTORIZING,
  AGGREGATING,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
