package com.aoimapper.analyzer.model;

import java.util.List;

/**
 * GeoJSON feature collection of one land-cover layer.
 *
 * @param type always {@code FeatureCollection}
 * @param features layer features
 */
public record GeoJsonFeatureCollection(String type, List<GeoJsonFeature> features) {}
