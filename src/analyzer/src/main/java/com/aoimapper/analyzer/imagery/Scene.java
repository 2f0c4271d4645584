package com.aoimapper.analyzer.imagery;

import java.time.Instant;
import java.util.Map;

/**
 * One acquisition returned by the imagery source, resampled onto the query grid.
 *
 * <p>Scenes arrive as the source sent them; {@link SceneNormalizer} enforces the schema before
 * they reach compositing.
 *
 * @param id scene identifier
 * @param acquired acquisition time, may be {@code null}
 * @param cloudFraction scene cloud fraction (0..1 or percent), may be {@code null}
 * @param bands samples per band, row-major on the query grid
 * @param dataMask optional per-sample data mask (0 = no data)
 * @param qa optional per-sample quality bitmask
 */
public record Scene(
    String id,
    Instant acquired,
    Double cloudFraction,
    Map<SpectralBand, float[]> bands,
    byte[] dataMask,
    int[] qa) {}
