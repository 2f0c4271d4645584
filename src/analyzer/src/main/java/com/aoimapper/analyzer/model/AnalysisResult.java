package com.aoimapper.analyzer.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Successful pipeline output: the area summary plus one layer per reported class.
 *
 * @param summary area summary
 * @param layers layer per class; every layered class is present
 */
public record AnalysisResult(AnalysisSummary summary, Map<LandCoverClass, LayerFeatureCollection> layers) {
  public AnalysisResult {
    EnumMap<LandCoverClass, LayerFeatureCollection> copy = new EnumMap<>(LandCoverClass.class);
    copy.putAll(layers);
    for (LandCoverClass landCoverClass : LandCoverClass.layered()) {
      if (!copy.containsKey(landCoverClass)) {
        throw new IllegalArgumentException("missing layer: " + landCoverClass.key());
      }
    }
    layers = Collections.unmodifiableMap(copy);
  }

  public LayerFeatureCollection layer(LandCoverClass landCoverClass) {
    return layers.get(landCoverClass);
  }
}
