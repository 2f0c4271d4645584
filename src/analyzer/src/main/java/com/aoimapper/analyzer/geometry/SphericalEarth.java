package com.aoimapper.analyzer.geometry;

import com.aoimapper.analyzer.model.GeoPoint;

/**
 * Great-circle formulas on the authalic sphere.
 *
 * <p>The same radius is used by {@link EqualAreaProjection}, so distances used to build an AOI
 * and areas measured on it refer to one Earth model.
 */
public final class SphericalEarth {
  /** Radius of the sphere with the WGS84 ellipsoid's surface area, in meters. */
  public static final double RADIUS_M = 6_371_007.181;

  private static final double POLE_EPSILON = 1e-12;

  private SphericalEarth() {}

  /**
   * Solves the direct geodesic problem: the point reached from {@code origin} after travelling
   * {@code distanceM} along the initial {@code bearingDeg} (clockwise from north).
   *
   * <p>At a pole every bearing points along a meridian, so bearing θ selects meridian
   * {@code λ0 + 180° − θ} from the north pole and {@code λ0 + θ} from the south pole.
   *
   * @param origin start point
   * @param bearingDeg initial bearing in degrees
   * @param distanceM distance along the great circle in meters
   * @return destination point with longitude normalized to [-180, 180]
   */
  public static GeoPoint destination(GeoPoint origin, double bearingDeg, double distanceM) {
    double lat1 = Math.toRadians(origin.latitude());
    double lon1 = Math.toRadians(origin.longitude());
    double bearing = Math.toRadians(bearingDeg);
    double delta = distanceM / RADIUS_M;

    double sinLat1 = Math.sin(lat1);
    double cosLat1 = Math.cos(lat1);
    double sinDelta = Math.sin(delta);
    double cosDelta = Math.cos(delta);

    double sinLat2 = clampUnit(sinLat1 * cosDelta + cosLat1 * sinDelta * Math.cos(bearing));
    double lat2 = Math.asin(sinLat2);

    double lon2;
    if (Math.abs(cosLat1) < POLE_EPSILON) {
      lon2 = sinLat1 > 0 ? lon1 + Math.PI - bearing : lon1 + bearing;
    } else {
      double y = Math.sin(bearing) * sinDelta * cosLat1;
      double x = cosDelta - sinLat1 * sinLat2;
      lon2 = lon1 + Math.atan2(y, x);
    }
    return new GeoPoint(Math.toDegrees(lat2), normalizeLongitude(Math.toDegrees(lon2)));
  }

  /**
   * Haversine great-circle distance.
   *
   * @param a first point
   * @param b second point
   * @return distance in meters
   */
  public static double distanceM(GeoPoint a, GeoPoint b) {
    double lat1 = Math.toRadians(a.latitude());
    double lat2 = Math.toRadians(b.latitude());
    double dLat = lat2 - lat1;
    double dLon = Math.toRadians(b.longitude() - a.longitude());
    double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
        + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
    return 2 * RADIUS_M * Math.asin(Math.min(1.0, Math.sqrt(h)));
  }

  public static double normalizeLongitude(double lonDeg) {
    if (lonDeg >= -180.0 && lonDeg <= 180.0) {
      return lonDeg;
    }
    double wrapped = ((lonDeg + 180.0) % 360.0 + 360.0) % 360.0 - 180.0;
    return wrapped == -180.0 && lonDeg > 0 ? 180.0 : wrapped;
  }

  /**
   * Shifts a longitude by whole turns so that it lies within 180 degrees of a reference.
   *
   * <p>Rings built around a reference longitude stay continuous across the antimeridian, at the
   * cost of values outside [-180, 180] (for example 180.02 around a center at 180).
   *
   * @param lonDeg longitude in degrees
   * @param referenceLonDeg reference longitude in degrees
   * @return equivalent longitude within [reference - 180, reference + 180]
   */
  public static double unwrapLongitude(double lonDeg, double referenceLonDeg) {
    return referenceLonDeg + normalizeLongitude(lonDeg - referenceLonDeg);
  }

  private static double clampUnit(double value) {
    return Math.max(-1.0, Math.min(1.0, value));
  }
}
