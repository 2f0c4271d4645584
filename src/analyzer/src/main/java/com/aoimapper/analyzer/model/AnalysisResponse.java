package com.aoimapper.analyzer.model;

import java.util.Map;

/**
 * Response contract for {@code POST /api/aoi/analyze}.
 *
 * @param summary area summary
 * @param layers GeoJSON layer per class key, in water, agriculture, forest, infrastructure order
 */
public record AnalysisResponse(AnalysisSummary summary, Map<String, GeoJsonFeatureCollection> layers) {}
