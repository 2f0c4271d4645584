package com.aoimapper.analyzer.imagery;

import com.aoimapper.analyzer.pipeline.CancellationToken;
import java.util.List;

/**
 * Request-scoped connection to the imagery source.
 *
 * <p>{@link #close()} must abort any search still in flight.
 */
public interface ImagerySession extends AutoCloseable {
  /**
   * Searches scenes intersecting the query geometry within its date range.
   *
   * @param query search parameters
   * @param token cancellation and deadline of the run
   * @return scenes as returned by the source, possibly empty
   */
  List<Scene> search(SceneQuery query, CancellationToken token);

  @Override
  void close();
}
