package com.aoimapper.analyzer.imagery;

import com.aoimapper.analyzer.config.AnalyzerProperties;
import com.aoimapper.analyzer.config.ImageryProperties;
import com.aoimapper.analyzer.geometry.EqualAreaProjection;
import com.aoimapper.analyzer.model.AoiGeometry;
import com.aoimapper.analyzer.pipeline.CancellationToken;
import com.aoimapper.analyzer.pipeline.DataUnavailableException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Acquires one representative composite covering an AOI.
 *
 * <p>Scenes are searched over the configured look-back window, checked against the scene
 * schema, filtered by cloud fraction and reduced with a per-pixel median.
 */
@Component
public class CompositeFetcher {
  private static final Logger log = LoggerFactory.getLogger(CompositeFetcher.class);

  private final ImageryProperties imageryProperties;
  private final AnalyzerProperties.Raster rasterProperties;
  private final CompositeCache cache;
  private final Clock clock;

  public CompositeFetcher(
      ImageryProperties imageryProperties,
      AnalyzerProperties analyzerProperties,
      CompositeCache cache,
      Clock clock) {
    this.imageryProperties = imageryProperties;
    this.rasterProperties = analyzerProperties.raster();
    this.cache = cache;
    this.clock = clock;
  }

  /**
   * Fetches the composite for an AOI.
   *
   * @param session request-scoped imagery session
   * @param aoi AOI geometry
   * @param projection planar reference of the run
   * @param token cancellation and deadline of the run
   * @return median composite on a grid covering the AOI
   * @throws DataUnavailableException when no qualifying scene or usable pixel exists
   */
  public RasterComposite fetch(
      ImagerySession session,
      AoiGeometry aoi,
      EqualAreaProjection projection,
      CancellationToken token) {
    SceneQuery query = buildQuery(aoi, projection);
    String fingerprint = CompositeFingerprint.of(query);
    Optional<RasterComposite> cached = cache.get(fingerprint);
    if (cached.isPresent()) {
      log.info("Using cached composite {} ({} scenes)", fingerprint, cached.get().sceneCount());
      return cached.get();
    }

    token.throwIfCancelled();
    List<Scene> scenes = session.search(query, token);
    token.throwIfCancelled();

    List<Scene> qualifying = new ArrayList<>();
    int rejected = 0;
    int cloudy = 0;
    for (Scene raw : scenes) {
      Optional<Scene> normalized = SceneNormalizer.normalize(raw, query.grid());
      if (normalized.isEmpty()) {
        rejected++;
        continue;
      }
      if (normalized.get().cloudFraction() > query.maxCloudFraction()) {
        cloudy++;
        continue;
      }
      qualifying.add(normalized.get());
    }
    log.info(
        "Imagery search returned {} scenes: {} qualifying, {} over cloud threshold, {} non-conforming",
        scenes.size(),
        qualifying.size(),
        cloudy,
        rejected);

    if (qualifying.isEmpty()) {
      throw new DataUnavailableException(String.format(
          Locale.ROOT,
          "No scenes found for AOI between %s and %s with cloud fraction <= %.2f",
          query.dateFrom(),
          query.dateTo(),
          query.maxCloudFraction()));
    }

    qualifying.sort(Comparator.comparing(Scene::id));
    RasterComposite composite = MedianCompositor.reduce(query.grid(), qualifying);
    if (composite.validCellCount() == 0) {
      throw new DataUnavailableException(
          "All pixels of the " + qualifying.size() + " qualifying scenes are masked (cloud or no data)");
    }
    cache.put(fingerprint, composite);
    return composite;
  }

  /**
   * Builds the scene query for an AOI from the configured date policy and grid resolution.
   *
   * @param aoi AOI geometry
   * @param projection planar reference of the run
   * @return scene query
   */
  public SceneQuery buildQuery(AoiGeometry aoi, EqualAreaProjection projection) {
    RasterGrid grid = RasterGrid.covering(
        projection.toPlane(aoi).getEnvelopeInternal(),
        projection.proj4(),
        rasterProperties.cellSizeM(),
        rasterProperties.maxCells());
    LocalDate dateTo = LocalDate.now(clock);
    LocalDate dateFrom = dateTo.minusDays(Math.max(1, imageryProperties.lookbackDays()));
    return new SceneQuery(
        aoi,
        grid,
        dateFrom,
        dateTo,
        imageryProperties.maxCloudFraction(),
        EnumSet.allOf(SpectralBand.class));
  }
}
