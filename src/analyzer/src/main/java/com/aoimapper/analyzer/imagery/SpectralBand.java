package com.aoimapper.analyzer.imagery;

/** Reflectance bands every composite carries. */
public enum SpectralBand {
  RED("red"),
  GREEN("green"),
  BLUE("blue"),
  NIR("nir"),
  SWIR("swir");

  private final String key;

  SpectralBand(String key) {
    this.key = key;
  }

  /**
   * Wire name of the band in imagery payloads and cache entries.
   *
   * @return lowercase band key
   */
  public String key() {
    return key;
  }
}
