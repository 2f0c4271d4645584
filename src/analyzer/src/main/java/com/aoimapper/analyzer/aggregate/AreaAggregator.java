package com.aoimapper.analyzer.aggregate;

import com.aoimapper.analyzer.geometry.EqualAreaProjection;
import com.aoimapper.analyzer.model.AnalysisSummary;
import com.aoimapper.analyzer.model.AoiGeometry;
import com.aoimapper.analyzer.model.AoiRequest;
import com.aoimapper.analyzer.model.LandCoverClass;
import com.aoimapper.analyzer.model.LayerFeatureCollection;
import com.aoimapper.analyzer.pipeline.InternalAnalysisException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Computes the area summary of an analyzed AOI.
 *
 * <p>All areas are planar areas in the AOI's equal-area projection, so the total and the
 * class areas share one formula.
 */
@Component
public class AreaAggregator {
  private static final double RELATIVE_TOLERANCE = 1e-9;
  private static final double ABSOLUTE_TOLERANCE_SQ_M = 1e-6;

  /**
   * Aggregates layer areas into a summary.
   *
   * @param request analysis input
   * @param aoi AOI geometry
   * @param projection planar reference of the run
   * @param layers one layer per reported class
   * @return area summary
   * @throws InternalAnalysisException when the class areas exceed the AOI area
   */
  public AnalysisSummary aggregate(
      AoiRequest request,
      AoiGeometry aoi,
      EqualAreaProjection projection,
      Map<LandCoverClass, LayerFeatureCollection> layers) {
    double total = projection.toPlane(aoi).getArea();

    Map<LandCoverClass, Double> areas = new EnumMap<>(LandCoverClass.class);
    double classified = 0.0;
    for (LandCoverClass landCoverClass : LandCoverClass.layered()) {
      LayerFeatureCollection layer = layers.get(landCoverClass);
      double area = layer == null ? 0.0 : layer.totalAreaSqM();
      areas.put(landCoverClass, area);
      classified += area;
    }
    if (classified > total + total * RELATIVE_TOLERANCE + ABSOLUTE_TOLERANCE_SQ_M) {
      throw new InternalAnalysisException(String.format(
          "Classified area %.3f m2 exceeds AOI area %.3f m2", classified, total));
    }

    double water = areas.get(LandCoverClass.WATER);
    double agriculture = areas.get(LandCoverClass.AGRICULTURE);
    double forest = areas.get(LandCoverClass.FOREST);
    double infrastructure = areas.get(LandCoverClass.INFRASTRUCTURE);
    return new AnalysisSummary(
        request.name(),
        request.latitude(),
        request.longitude(),
        request.areaSqM(),
        aoi.radiusM(),
        total,
        water,
        percent(water, total),
        agriculture,
        percent(agriculture, total),
        forest,
        percent(forest, total),
        infrastructure,
        percent(infrastructure, total));
  }

  static double percent(double area, double total) {
    if (!(total > 0)) {
      return 0.0;
    }
    return BigDecimal.valueOf(100.0 * area / total).setScale(4, RoundingMode.HALF_UP).doubleValue();
  }
}
