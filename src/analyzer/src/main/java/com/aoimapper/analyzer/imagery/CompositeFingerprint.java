package com.aoimapper.analyzer.imagery;

import com.aoimapper.analyzer.model.GeoPoint;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/** Deterministic cache key of a composite request. */
public final class CompositeFingerprint {
  private CompositeFingerprint() {}

  /**
   * Hashes every query input that changes the composite.
   *
   * @param query scene query
   * @return lowercase hex SHA-256 digest
   */
  public static String of(SceneQuery query) {
    StringBuilder canonical = new StringBuilder();
    for (GeoPoint vertex : query.geometry().vertices()) {
      canonical.append(String.format(Locale.ROOT, "%.7f,%.7f;", vertex.latitude(), vertex.longitude()));
    }
    RasterGrid grid = query.grid();
    canonical.append('|').append(grid.crs())
        .append(String.format(Locale.ROOT, "|%.4f|%.4f|%.6f|%d|%d",
            grid.originX(), grid.originY(), grid.cellSize(), grid.columns(), grid.rows()));
    canonical.append('|').append(query.dateFrom()).append('|').append(query.dateTo());
    canonical.append(String.format(Locale.ROOT, "|%.6f", query.maxCloudFraction()));
    query.bands().stream().sorted().forEach(band -> canonical.append('|').append(band.key()));

    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
