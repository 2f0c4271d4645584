package com.aoimapper.analyzer.vectorize;

import org.locationtech.jts.geom.Coordinate;

/**
 * Closed boundary ring of one region, in planar coordinates.
 *
 * @param region id of the region on the ring's left
 * @param coordinates closed coordinate ring
 * @param shell {@code true} for counter-clockwise outer rings, {@code false} for holes
 */
record TracedRing(int region, Coordinate[] coordinates, boolean shell) {}
