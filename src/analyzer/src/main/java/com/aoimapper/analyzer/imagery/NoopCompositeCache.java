package com.aoimapper.analyzer.imagery;

import java.util.Optional;

/** Cache used when composite caching is disabled. */
public class NoopCompositeCache implements CompositeCache {
  @Override
  public Optional<RasterComposite> get(String fingerprint) {
    return Optional.empty();
  }

  @Override
  public void put(String fingerprint, RasterComposite composite) {
    // caching disabled
  }
}
