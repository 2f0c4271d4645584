package com.aoimapper.analyzer.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Area accounting for one analyzed AOI.
 *
 * <p>{@code totalAreaSqM} is the area of the AOI polygon itself. Class areas only cover
 * classified regions, so their sum never exceeds the total.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisSummary(
    String name,
    double latitude,
    double longitude,
    double inputAreaSqM,
    double calculatedRadiusM,
    double totalAreaSqM,
    double waterAreaSqM,
    double waterPct,
    double agricultureAreaSqM,
    double agriculturePct,
    double forestAreaSqM,
    double forestPct,
    double infrastructureAreaSqM,
    double infrastructurePct) {

  /**
   * Returns the reported area of a layered class.
   *
   * @param landCoverClass layered class
   * @return class area in square meters
   */
  public double areaSqM(LandCoverClass landCoverClass) {
    return switch (landCoverClass) {
      case WATER -> waterAreaSqM;
      case AGRICULTURE -> agricultureAreaSqM;
      case FOREST -> forestAreaSqM;
      case INFRASTRUCTURE -> infrastructureAreaSqM;
      case UNCLASSIFIED -> throw new IllegalArgumentException("unclassified area is not reported");
    };
  }

  public double classifiedAreaSqM() {
    return waterAreaSqM + agricultureAreaSqM + forestAreaSqM + infrastructureAreaSqM;
  }
}
