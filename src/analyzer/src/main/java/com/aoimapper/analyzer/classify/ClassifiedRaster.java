package com.aoimapper.analyzer.classify;

import com.aoimapper.analyzer.imagery.RasterGrid;
import com.aoimapper.analyzer.model.LandCoverClass;
import java.util.List;

/**
 * Per-cell land-cover labels on the composite grid.
 *
 * <p>Labels are stored as {@link LandCoverClass} ordinals.
 *
 * @param grid raster grid
 * @param labels label ordinal per cell, row-major
 * @param precedence class order used when layers overlap
 */
public record ClassifiedRaster(RasterGrid grid, byte[] labels, List<LandCoverClass> precedence) {
  private static final LandCoverClass[] CLASSES = LandCoverClass.values();

  public ClassifiedRaster {
    if (labels.length != grid.cellCount()) {
      throw new IllegalArgumentException("label raster must have " + grid.cellCount() + " cells");
    }
    precedence = List.copyOf(precedence);
  }

  public LandCoverClass label(int index) {
    return CLASSES[labels[index]];
  }

  public LandCoverClass label(int column, int row) {
    return label(grid.index(column, row));
  }

  public int count(LandCoverClass landCoverClass) {
    int count = 0;
    byte ordinal = (byte) landCoverClass.ordinal();
    for (byte label : labels) {
      if (label == ordinal) {
        count++;
      }
    }
    return count;
  }
}
