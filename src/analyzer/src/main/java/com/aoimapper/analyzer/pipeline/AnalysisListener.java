package com.aoimapper.analyzer.pipeline;

/**
 * Observer of analysis state transitions.
 *
 * <p>Spring beans implementing this interface are picked up by {@link AnalysisOrchestrator}.
 * Listener failures are logged and never affect the run.
 */
public interface AnalysisListener {
  default void onTransition(String requestName, AnalysisStage from, AnalysisStage to) {}

  default void onFailure(String requestName, AnalysisStage stage, AnalysisException failure) {}
}
