package com.aoimapper.analyzer.model;

import java.util.Map;

/**
 * GeoJSON feature.
 *
 * @param type always {@code Feature}
 * @param geometry GeoJSON geometry object
 * @param properties feature properties
 */
public record GeoJsonFeature(String type, Map<String, Object> geometry, Map<String, Object> properties) {}
