package com.aoimapper.analyzer.imagery;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Single multi-band raster reduced from qualifying scenes.
 *
 * @param grid raster grid
 * @param bands per-band reflectance, row-major
 * @param valid per-cell validity; invalid cells had no usable observation
 * @param sceneCount number of scenes that contributed
 */
public record RasterComposite(
    RasterGrid grid,
    Map<SpectralBand, float[]> bands,
    boolean[] valid,
    int sceneCount) {
  public RasterComposite {
    int cells = grid.cellCount();
    EnumMap<SpectralBand, float[]> copy = new EnumMap<>(SpectralBand.class);
    for (SpectralBand band : SpectralBand.values()) {
      float[] values = bands.get(band);
      if (values == null || values.length != cells) {
        throw new IllegalArgumentException("band " + band.key() + " must have " + cells + " samples");
      }
      copy.put(band, values);
    }
    if (valid.length != cells) {
      throw new IllegalArgumentException("validity mask must have " + cells + " samples");
    }
    bands = Collections.unmodifiableMap(copy);
  }

  public float value(SpectralBand band, int index) {
    return bands.get(band)[index];
  }

  public boolean isValid(int index) {
    return valid[index];
  }

  public int validCellCount() {
    int count = 0;
    for (boolean cell : valid) {
      if (cell) {
        count++;
      }
    }
    return count;
  }
}
