package com.aoimapper.analyzer.model;

/**
 * Immutable analysis input: a named circular area around a center point.
 *
 * @param name caller-supplied label echoed in the summary
 * @param latitude center latitude in degrees
 * @param longitude center longitude in degrees
 * @param areaSqM target area of the circle in square meters
 */
public record AoiRequest(String name, double latitude, double longitude, double areaSqM) {
  public GeoPoint center() {
    return new GeoPoint(latitude, longitude);
  }
}
