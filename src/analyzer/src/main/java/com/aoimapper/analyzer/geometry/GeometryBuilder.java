package com.aoimapper.analyzer.geometry;

import com.aoimapper.analyzer.config.AnalyzerProperties;
import com.aoimapper.analyzer.model.AoiGeometry;
import com.aoimapper.analyzer.model.AoiRequest;
import com.aoimapper.analyzer.model.GeoPoint;
import com.aoimapper.analyzer.pipeline.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns an {@link AoiRequest} into a closed polygon approximating a geodesic circle whose
 * area is the requested area.
 *
 * <p>Vertex longitudes are unwrapped around the center longitude, so a ring crossing the
 * antimeridian is continuous and may carry longitudes beyond 180 or below -180.
 *
 * <p>The radius {@code sqrt(area / π)} is measured along the sphere, so the ring encloses a
 * spherical cap rather than a flat disc. The cap is smaller than the requested area by about
 * {@code (r / R)² / 12}: under 0.01% up to roughly 1.5e11 m², about 6% at 1e14 m². Areas
 * above {@link #MAX_AREA_SQ_M}, whose radius would reach a quarter of a great circle, are
 * rejected.
 */
@Component
public class GeometryBuilder {
  public static final int MIN_VERTICES = 32;
  public static final int DEFAULT_VERTICES = 64;
  /** Area whose radius equals a quarter great circle ({@code π³R²/4}, about 3.1e14 m²). */
  public static final double MAX_AREA_SQ_M =
      Math.PI * Math.pow(Math.PI * SphericalEarth.RADIUS_M / 2.0, 2);

  private final int vertexCount;

  @Autowired
  public GeometryBuilder(AnalyzerProperties properties) {
    this(properties.geometry() == null ? DEFAULT_VERTICES : properties.geometry().vertexCount());
  }

  public GeometryBuilder(int vertexCount) {
    if (vertexCount < MIN_VERTICES) {
      throw new IllegalArgumentException("vertex count must be >= " + MIN_VERTICES);
    }
    this.vertexCount = vertexCount;
  }

  /**
   * Validates the request and builds its AOI ring.
   *
   * @param request analysis input
   * @return counter-clockwise closed ring of {@code vertexCount + 1} vertices
   * @throws ValidationException when a request field is out of range
   */
  public AoiGeometry build(AoiRequest request) {
    validate(request);
    double radiusM = radiusFor(request.areaSqM());
    GeoPoint center = request.center();

    List<GeoPoint> vertices = new ArrayList<>(vertexCount + 1);
    double step = 360.0 / vertexCount;
    // Descending bearings walk the ring counter-clockwise.
    for (int i = 0; i < vertexCount; i++) {
      double bearing = i == 0 ? 0.0 : 360.0 - i * step;
      GeoPoint vertex = SphericalEarth.destination(center, bearing, radiusM);
      vertices.add(new GeoPoint(
          vertex.latitude(), SphericalEarth.unwrapLongitude(vertex.longitude(), center.longitude())));
    }
    vertices.add(vertices.get(0));
    return new AoiGeometry(center, radiusM, vertices);
  }

  public static double radiusFor(double areaSqM) {
    return Math.sqrt(areaSqM / Math.PI);
  }

  /**
   * Checks the request constraints.
   *
   * @param request analysis input
   */
  public static void validate(AoiRequest request) {
    if (request == null) {
      throw new ValidationException("request body is required");
    }
    if (request.name() == null || request.name().isBlank()) {
      throw new ValidationException("name must not be blank");
    }
    if (!Double.isFinite(request.latitude()) || request.latitude() < -90 || request.latitude() > 90) {
      throw new ValidationException("latitude must be within [-90,90]");
    }
    if (!Double.isFinite(request.longitude()) || request.longitude() < -180 || request.longitude() > 180) {
      throw new ValidationException("longitude must be within [-180,180]");
    }
    if (Double.isNaN(request.areaSqM()) || request.areaSqM() <= 0) {
      throw new ValidationException("area_sq_m must be > 0");
    }
    if (Double.isInfinite(request.areaSqM())) {
      throw new ValidationException("area_sq_m must be finite");
    }
    if (request.areaSqM() > MAX_AREA_SQ_M) {
      throw new ValidationException(String.format(
          Locale.ROOT, "area_sq_m must be <= %.4e", MAX_AREA_SQ_M));
    }
  }
}
