package com.aoimapper.analyzer.model;

import com.aoimapper.analyzer.pipeline.ValidationException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Duration;

/**
 * Request contract for {@code POST /api/aoi/analyze}.
 *
 * @param name AOI label
 * @param latitude center latitude in degrees
 * @param longitude center longitude in degrees
 * @param areaSqM target area in square meters
 * @param timeoutSeconds optional caller time bound
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalyzeRequest(
    String name,
    Double latitude,
    Double longitude,
    Double areaSqM,
    Double timeoutSeconds) {

  /**
   * Converts the payload into a pipeline request. Range checks are left to the pipeline.
   *
   * @return analysis input
   * @throws ValidationException when a required field is missing
   */
  public AoiRequest toAoiRequest() {
    if (latitude == null) {
      throw new ValidationException("latitude is required");
    }
    if (longitude == null) {
      throw new ValidationException("longitude is required");
    }
    if (areaSqM == null) {
      throw new ValidationException("area_sq_m is required");
    }
    return new AoiRequest(name, latitude, longitude, areaSqM);
  }

  /**
   * Returns the caller time bound, or {@code null} when none was sent.
   *
   * @return requested timeout
   */
  public Duration timeout() {
    if (timeoutSeconds == null) {
      return null;
    }
    if (!Double.isFinite(timeoutSeconds) || timeoutSeconds <= 0) {
      throw new ValidationException("timeout_seconds must be > 0");
    }
    return Duration.ofMillis(Math.max(1L, Math.round(Math.min(timeoutSeconds, 86_400.0) * 1000.0)));
  }
}
