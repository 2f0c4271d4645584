package com.aoimapper.analyzer.model;

/**
 * Geographic position in decimal degrees.
 *
 * @param latitude latitude in degrees
 * @param longitude longitude in degrees
 */
public record GeoPoint(double latitude, double longitude) {}
