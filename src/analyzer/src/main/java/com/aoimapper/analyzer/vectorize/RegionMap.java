package com.aoimapper.analyzer.vectorize;

import com.aoimapper.analyzer.model.LandCoverClass;

/**
 * 4-connected regions of equally labeled cells.
 *
 * @param regionOf region id per cell, {@code -1} for unclassified cells
 * @param cellCounts cell count per region id
 * @param classes class ordinal per region id
 * @param regionCount number of regions
 */
record RegionMap(int[] regionOf, int[] cellCounts, byte[] classes, int regionCount) {
  private static final LandCoverClass[] CLASSES = LandCoverClass.values();

  LandCoverClass landCoverClass(int region) {
    return CLASSES[classes[region]];
  }
}
