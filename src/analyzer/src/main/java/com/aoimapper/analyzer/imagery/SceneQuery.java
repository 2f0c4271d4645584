package com.aoimapper.analyzer.imagery;

import com.aoimapper.analyzer.model.AoiGeometry;
import java.time.LocalDate;
import java.util.Set;

/**
 * Scene search parameters sent to the imagery source.
 *
 * @param geometry AOI to intersect
 * @param grid grid the source resamples scenes onto
 * @param dateFrom first acquisition day (inclusive, UTC)
 * @param dateTo last acquisition day (inclusive, UTC)
 * @param maxCloudFraction cloud fraction threshold in 0..1
 * @param bands requested bands
 */
public record SceneQuery(
    AoiGeometry geometry,
    RasterGrid grid,
    LocalDate dateFrom,
    LocalDate dateTo,
    double maxCloudFraction,
    Set<SpectralBand> bands) {}
