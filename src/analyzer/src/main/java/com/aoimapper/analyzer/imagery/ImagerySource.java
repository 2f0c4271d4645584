package com.aoimapper.analyzer.imagery;

/**
 * Factory of per-request imagery sessions.
 *
 * <p>The orchestrator opens one session per analysis run and closes it on every exit path.
 */
public interface ImagerySource {
  ImagerySession openSession();
}
