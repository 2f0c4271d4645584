package com.aoimapper.analyzer.classify;

import com.aoimapper.analyzer.config.AnalyzerProperties;
import com.aoimapper.analyzer.model.LandCoverClass;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered list of classification rules; the first matching rule labels a cell.
 *
 * <p>The rule order is the class precedence: it also decides which layer keeps an area when
 * simplified layers overlap.
 */
public record ClassificationPolicy(List<ClassificationRule> rules) {
  public ClassificationPolicy {
    rules = List.copyOf(rules);
    Set<LandCoverClass> seen = EnumSet.noneOf(LandCoverClass.class);
    for (ClassificationRule rule : rules) {
      if (!seen.add(rule.target())) {
        throw new IllegalArgumentException("duplicate rule for " + rule.target().key());
      }
    }
    if (!seen.containsAll(LandCoverClass.layered())) {
      throw new IllegalArgumentException("every reported class needs a rule");
    }
  }

  /**
   * Builds the default rule order: water, infrastructure, forest, agriculture.
   *
   * @param classification configured thresholds
   * @return policy
   */
  public static ClassificationPolicy fromProperties(AnalyzerProperties.Classification classification) {
    return new ClassificationPolicy(List.of(
        new ClassificationRule(LandCoverClass.WATER, SpectralIndex.NDWI, classification.ndwiWater()),
        new ClassificationRule(
            LandCoverClass.INFRASTRUCTURE, SpectralIndex.NDBI, classification.ndbiInfrastructure()),
        new ClassificationRule(LandCoverClass.FOREST, SpectralIndex.NDVI, classification.ndviForest()),
        new ClassificationRule(
            LandCoverClass.AGRICULTURE, SpectralIndex.NDVI, classification.ndviAgriculture())));
  }

  public List<LandCoverClass> precedence() {
    List<LandCoverClass> order = new ArrayList<>(rules.size());
    for (ClassificationRule rule : rules) {
      order.add(rule.target());
    }
    return List.copyOf(order);
  }
}
