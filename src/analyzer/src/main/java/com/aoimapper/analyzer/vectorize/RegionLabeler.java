package com.aoimapper.analyzer.vectorize;

import com.aoimapper.analyzer.classify.ClassifiedRaster;
import com.aoimapper.analyzer.imagery.RasterGrid;
import com.aoimapper.analyzer.model.LandCoverClass;
import java.util.Arrays;

/** Breadth-first labeling of 4-connected same-class cells. */
final class RegionLabeler {
  private RegionLabeler() {}

  static RegionMap label(ClassifiedRaster raster) {
    RasterGrid grid = raster.grid();
    int columns = grid.columns();
    int rows = grid.rows();
    byte[] labels = raster.labels();
    byte unclassified = (byte) LandCoverClass.UNCLASSIFIED.ordinal();

    int[] regionOf = new int[labels.length];
    Arrays.fill(regionOf, -1);
    int[] queue = new int[labels.length];
    int[] cellCounts = new int[16];
    byte[] classes = new byte[16];
    int regionCount = 0;

    for (int seed = 0; seed < labels.length; seed++) {
      if (regionOf[seed] != -1 || labels[seed] == unclassified) {
        continue;
      }
      if (regionCount == cellCounts.length) {
        cellCounts = Arrays.copyOf(cellCounts, regionCount * 2);
        classes = Arrays.copyOf(classes, regionCount * 2);
      }
      int region = regionCount++;
      byte label = labels[seed];
      int head = 0;
      int tail = 0;
      queue[tail++] = seed;
      regionOf[seed] = region;
      while (head < tail) {
        int cell = queue[head++];
        int column = cell % columns;
        int row = cell / columns;
        if (column > 0 && visit(cell - 1, label, region, labels, regionOf)) {
          queue[tail++] = cell - 1;
        }
        if (column < columns - 1 && visit(cell + 1, label, region, labels, regionOf)) {
          queue[tail++] = cell + 1;
        }
        if (row > 0 && visit(cell - columns, label, region, labels, regionOf)) {
          queue[tail++] = cell - columns;
        }
        if (row < rows - 1 && visit(cell + columns, label, region, labels, regionOf)) {
          queue[tail++] = cell + columns;
        }
      }
      cellCounts[region] = tail;
      classes[region] = label;
    }
    return new RegionMap(
        regionOf,
        Arrays.copyOf(cellCounts, regionCount),
        Arrays.copyOf(classes, regionCount),
        regionCount);
  }

  private static boolean visit(int cell, byte label, int region, byte[] labels, int[] regionOf) {
    if (regionOf[cell] != -1 || labels[cell] != label) {
      return false;
    }
    regionOf[cell] = region;
    return true;
  }
}
