package com.aoimapper.analyzer;

import com.aoimapper.analyzer.config.AnalyzerProperties;
import com.aoimapper.analyzer.config.ImageryProperties;
import com.aoimapper.analyzer.geometry.EqualAreaProjection;
import com.aoimapper.analyzer.geometry.GeometryBuilder;
import com.aoimapper.analyzer.imagery.RasterGrid;
import com.aoimapper.analyzer.imagery.Scene;
import com.aoimapper.analyzer.imagery.SpectralBand;
import com.aoimapper.analyzer.model.AoiGeometry;
import com.aoimapper.analyzer.model.AoiRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/** Shared builders for analyzer tests. */
public final class TestFixtures {
  /** Reflectance per band in {@link SpectralBand} order: red, green, blue, nir, swir. */
  public static final float[] WATER = {0.05f, 0.30f, 0.10f, 0.05f, 0.02f};
  public static final float[] FOREST = {0.05f, 0.08f, 0.04f, 0.50f, 0.20f};
  public static final float[] AGRICULTURE = {0.10f, 0.10f, 0.06f, 0.30f, 0.20f};
  public static final float[] INFRASTRUCTURE = {0.18f, 0.15f, 0.14f, 0.20f, 0.40f};
  public static final float[] BARE = {0.20f, 0.20f, 0.18f, 0.25f, 0.26f};

  private TestFixtures() {}

  @FunctionalInterface
  public interface Signature {
    float[] at(int column, int row);
  }

  public static AnalyzerProperties analyzerProperties() {
    return new AnalyzerProperties(
        new AnalyzerProperties.Geometry(64),
        new AnalyzerProperties.Raster(10.0, 4_000_000L),
        new AnalyzerProperties.Classification(0.3, 0.1, 0.6, 0.35),
        new AnalyzerProperties.Vectorization(5.0, 200.0),
        new AnalyzerProperties.Timeouts(Duration.ofSeconds(120), Duration.ofSeconds(600)));
  }

  public static ImageryProperties imageryProperties(String baseUrl) {
    return new ImageryProperties(
        baseUrl,
        null,
        null,
        null,
        365,
        0.4,
        Duration.ofSeconds(90),
        new ImageryProperties.Cache(false, "aoimapper:composite:", Duration.ofHours(6)));
  }

  public static AoiGeometry aoi(double latitude, double longitude, double areaSqM) {
    return new GeometryBuilder(64).build(new AoiRequest("test", latitude, longitude, areaSqM));
  }

  public static RasterGrid gridFor(AoiGeometry aoi, EqualAreaProjection projection) {
    return RasterGrid.covering(
        projection.toPlane(aoi).getEnvelopeInternal(), projection.proj4(), 10.0, 4_000_000L);
  }

  public static Scene uniformScene(String id, Double cloudFraction, RasterGrid grid, float[] signature) {
    return scene(id, cloudFraction, grid, (column, row) -> signature);
  }

  public static Scene scene(String id, Double cloudFraction, RasterGrid grid, Signature signature) {
    Map<SpectralBand, float[]> bands = new EnumMap<>(SpectralBand.class);
    SpectralBand[] order = SpectralBand.values();
    for (SpectralBand band : order) {
      bands.put(band, new float[grid.cellCount()]);
    }
    for (int row = 0; row < grid.rows(); row++) {
      for (int column = 0; column < grid.columns(); column++) {
        float[] values = signature.at(column, row);
        for (int b = 0; b < order.length; b++) {
          bands.get(order[b])[grid.index(column, row)] = values[b];
        }
      }
    }
    return new Scene(id, Instant.parse("2026-01-15T10:30:00Z"), cloudFraction, bands, null, null);
  }
}
