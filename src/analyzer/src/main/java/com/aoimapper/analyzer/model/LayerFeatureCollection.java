package com.aoimapper.analyzer.model;

import java.util.List;

/**
 * Polygons of a single land-cover class, disjoint and clipped to the AOI.
 *
 * @param landCoverClass layer class
 * @param features layer polygons, possibly empty
 */
public record LayerFeatureCollection(LandCoverClass landCoverClass, List<LandCoverFeature> features) {
  public LayerFeatureCollection {
    features = List.copyOf(features);
  }

  public static LayerFeatureCollection empty(LandCoverClass landCoverClass) {
    return new LayerFeatureCollection(landCoverClass, List.of());
  }

  public boolean isEmpty() {
    return features.isEmpty();
  }

  public double totalAreaSqM() {
    return features.stream().mapToDouble(LandCoverFeature::areaSqM).sum();
  }
}
