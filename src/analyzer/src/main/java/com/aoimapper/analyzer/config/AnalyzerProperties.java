package com.aoimapper.analyzer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "analyzer")
public record AnalyzerProperties(
    Geometry geometry,
    Raster raster,
    Classification classification,
    Vectorization vectorization,
    Timeouts timeouts) {
  public record Geometry(int vertexCount) {}

  public record Raster(double cellSizeM, long maxCells) {}

  public record Classification(
      double ndwiWater,
      double ndbiInfrastructure,
      double ndviForest,
      double ndviAgriculture) {}

  public record Vectorization(double simplifyToleranceM, double minRegionAreaSqM) {}

  public record Timeouts(Duration defaultTimeout, Duration maxTimeout) {}
}
