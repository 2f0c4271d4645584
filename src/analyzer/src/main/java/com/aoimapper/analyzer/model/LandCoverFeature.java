package com.aoimapper.analyzer.model;

import org.locationtech.jts.geom.Polygon;

/**
 * One simple polygon of a land-cover layer.
 *
 * @param landCoverClass class of the region
 * @param planar polygon in the AOI's equal-area plane (meters)
 * @param geographic the same polygon in longitude/latitude degrees
 * @param areaSqM area of the planar polygon
 */
public record LandCoverFeature(
    LandCoverClass landCoverClass,
    Polygon planar,
    Polygon geographic,
    double areaSqM) {}
