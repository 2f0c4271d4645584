package com.aoimapper.analyzer.imagery;

import java.util.Optional;

/** Optional store of composites keyed by {@link CompositeFingerprint}. */
public interface CompositeCache {
  /**
   * Returns a composite cached within the freshness window.
   *
   * @param fingerprint request fingerprint
   * @return cached composite, or empty when absent or stale
   */
  Optional<RasterComposite> get(String fingerprint);

  void put(String fingerprint, RasterComposite composite);
}
