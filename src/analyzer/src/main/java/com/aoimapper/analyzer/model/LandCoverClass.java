package com.aoimapper.analyzer.model;

import java.util.List;

/**
 * Land-cover label assigned to a raster cell.
 *
 * <p>{@link #UNCLASSIFIED} marks cells that failed every classification predicate or had no
 * valid observation. It never produces a vector layer.
 */
public enum LandCoverClass {
  WATER("water"),
  AGRICULTURE("agriculture"),
  FOREST("forest"),
  INFRASTRUCTURE("infrastructure"),
  UNCLASSIFIED("unclassified");

  private static final List<LandCoverClass> LAYERED = List.of(WATER, AGRICULTURE, FOREST, INFRASTRUCTURE);

  private final String key;

  LandCoverClass(String key) {
    this.key = key;
  }

  /**
   * Returns the lowercase key used in layer maps and feature properties.
   *
   * @return stable external key
   */
  public String key() {
    return key;
  }

  /**
   * Returns the classes that are reported as layers, in output order.
   *
   * @return water, agriculture, forest, infrastructure
   */
  public static List<LandCoverClass> layered() {
    return LAYERED;
  }
}
