package com.aoimapper.analyzer.classify;

import com.aoimapper.analyzer.imagery.RasterComposite;
import com.aoimapper.analyzer.imagery.SpectralBand;

/**
 * Normalized-difference spectral indices used by the classification rules.
 *
 * <p>Each index is {@code (a - b) / (a + b)} over two bands of the composite.
 */
public enum SpectralIndex {
  /** Normalized difference water index (green, near infrared). */
  NDWI(SpectralBand.GREEN, SpectralBand.NIR),
  /** Normalized difference vegetation index (near infrared, red). */
  NDVI(SpectralBand.NIR, SpectralBand.RED),
  /** Normalized difference built-up index (shortwave infrared, near infrared). */
  NDBI(SpectralBand.SWIR, SpectralBand.NIR);

  private final SpectralBand first;
  private final SpectralBand second;

  SpectralIndex(SpectralBand first, SpectralBand second) {
    this.first = first;
    this.second = second;
  }

  /**
   * Evaluates the index at one composite cell.
   *
   * @param composite source composite
   * @param index cell index
   * @return index value, or {@code NaN} when the denominator is zero or not finite
   */
  public double at(RasterComposite composite, int index) {
    return normalizedDifference(composite.value(first, index), composite.value(second, index));
  }

  public static double normalizedDifference(double a, double b) {
    double denominator = a + b;
    if (denominator == 0.0 || !Double.isFinite(denominator)) {
      return Double.NaN;
    }
    return (a - b) / denominator;
  }
}
