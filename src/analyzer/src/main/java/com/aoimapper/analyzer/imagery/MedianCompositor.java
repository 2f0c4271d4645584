package com.aoimapper.analyzer.imagery;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;

/** Per-pixel, per-band median reduction of normalized scenes. */
public final class MedianCompositor {
  private MedianCompositor() {}

  /**
   * Reduces scenes to one composite. Cells without any usable sample are marked invalid and
   * carry NaN reflectance.
   *
   * @param grid shared grid of the scenes
   * @param scenes normalized scenes in a deterministic order
   * @return composite raster
   */
  public static RasterComposite reduce(RasterGrid grid, List<Scene> scenes) {
    int cells = grid.cellCount();
    SpectralBand[] bandOrder = SpectralBand.values();
    EnumMap<SpectralBand, float[]> out = new EnumMap<>(SpectralBand.class);
    for (SpectralBand band : bandOrder) {
      out.put(band, new float[cells]);
    }
    boolean[] valid = new boolean[cells];
    float[] buffer = new float[scenes.size()];
    Scene[] usable = new Scene[scenes.size()];

    for (int cell = 0; cell < cells; cell++) {
      int count = 0;
      for (Scene scene : scenes) {
        if (SceneNormalizer.isUsable(scene, cell)) {
          usable[count++] = scene;
        }
      }
      valid[cell] = count > 0;
      for (SpectralBand band : bandOrder) {
        if (count == 0) {
          out.get(band)[cell] = Float.NaN;
          continue;
        }
        for (int i = 0; i < count; i++) {
          buffer[i] = usable[i].bands().get(band)[cell];
        }
        out.get(band)[cell] = median(buffer, count);
      }
    }
    return new RasterComposite(grid, out, valid, scenes.size());
  }

  static float median(float[] values, int count) {
    Arrays.sort(values, 0, count);
    int mid = count / 2;
    if (count % 2 == 1) {
      return values[mid];
    }
    return (float) (((double) values[mid - 1] + (double) values[mid]) / 2.0);
  }
}
