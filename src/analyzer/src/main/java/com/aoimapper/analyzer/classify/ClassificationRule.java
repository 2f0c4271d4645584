package com.aoimapper.analyzer.classify;

import com.aoimapper.analyzer.imagery.RasterComposite;
import com.aoimapper.analyzer.model.LandCoverClass;

/**
 * Threshold predicate assigning a class when {@code index > threshold}.
 *
 * @param target class assigned on match
 * @param index spectral index tested
 * @param threshold strict lower bound
 */
public record ClassificationRule(LandCoverClass target, SpectralIndex index, double threshold) {
  public ClassificationRule {
    if (target == null || target == LandCoverClass.UNCLASSIFIED) {
      throw new IllegalArgumentException("rule target must be a reported class");
    }
    if (index == null) {
      throw new IllegalArgumentException("rule index is required");
    }
    if (!Double.isFinite(threshold)) {
      throw new IllegalArgumentException("rule threshold must be finite");
    }
  }

  /** NaN index values never match. */
  public boolean matches(RasterComposite composite, int cell) {
    return index.at(composite, cell) > threshold;
  }
}
