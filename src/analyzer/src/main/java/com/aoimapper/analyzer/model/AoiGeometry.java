package com.aoimapper.analyzer.model;

import java.util.List;

/**
 * Closed polygon approximating a geodesic circle.
 *
 * <p>Vertices run counter-clockwise in (east, north) order and the last vertex repeats the
 * first.
 *
 * @param center circle center
 * @param radiusM geodesic radius in meters
 * @param vertices closed vertex ring
 */
public record AoiGeometry(GeoPoint center, double radiusM, List<GeoPoint> vertices) {
  public AoiGeometry {
    vertices = List.copyOf(vertices);
    if (vertices.size() < 4) {
      throw new IllegalArgumentException("AOI ring needs at least 4 vertices");
    }
    if (!vertices.get(0).equals(vertices.get(vertices.size() - 1))) {
      throw new IllegalArgumentException("AOI ring must be closed");
    }
  }

  /**
   * Number of distinct vertices (the closing vertex is not counted).
   *
   * @return ring vertex count
   */
  public int vertexCount() {
    return vertices.size() - 1;
  }
}
