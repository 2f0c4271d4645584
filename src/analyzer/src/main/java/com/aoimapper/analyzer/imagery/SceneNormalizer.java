package com.aoimapper.analyzer.imagery;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces the scene schema at the imagery boundary.
 *
 * <p>A conforming scene carries every {@link SpectralBand} with exactly one sample per grid
 * cell and a cloud fraction. Percent cloud values are normalized to 0..1.
 */
public final class SceneNormalizer {
  private static final Logger log = LoggerFactory.getLogger(SceneNormalizer.class);

  /** Opaque cloud bit of the QA bitmask. */
  public static final int QA_CLOUD_BIT = 1 << 10;
  /** Cirrus bit of the QA bitmask. */
  public static final int QA_CIRRUS_BIT = 1 << 11;

  private SceneNormalizer() {}

  /**
   * Validates and normalizes a raw scene.
   *
   * @param scene raw scene
   * @param grid query grid
   * @return normalized scene, or empty when the scene does not conform
   */
  public static Optional<Scene> normalize(Scene scene, RasterGrid grid) {
    String id = scene.id() == null ? "<unnamed>" : scene.id();
    Double cloud = normalizeCloudFraction(scene.cloudFraction());
    if (cloud == null) {
      log.warn("Rejecting scene {}: unusable cloud fraction {}", id, scene.cloudFraction());
      return Optional.empty();
    }

    int cells = grid.cellCount();
    Map<SpectralBand, float[]> bands = scene.bands() == null ? Map.of() : scene.bands();
    EnumMap<SpectralBand, float[]> checked = new EnumMap<>(SpectralBand.class);
    for (SpectralBand band : SpectralBand.values()) {
      float[] samples = bands.get(band);
      if (samples == null) {
        log.warn("Rejecting scene {}: missing band {}", id, band.key());
        return Optional.empty();
      }
      if (samples.length != cells) {
        log.warn("Rejecting scene {}: band {} has {} samples, expected {}", id, band.key(), samples.length, cells);
        return Optional.empty();
      }
      checked.put(band, samples);
    }
    if (scene.dataMask() != null && scene.dataMask().length != cells) {
      log.warn("Rejecting scene {}: data mask has {} samples, expected {}", id, scene.dataMask().length, cells);
      return Optional.empty();
    }
    if (scene.qa() != null && scene.qa().length != cells) {
      log.warn("Rejecting scene {}: qa has {} samples, expected {}", id, scene.qa().length, cells);
      return Optional.empty();
    }
    return Optional.of(new Scene(id, scene.acquired(), cloud, checked, scene.dataMask(), scene.qa()));
  }

  /**
   * Whether a normalized scene has a usable observation at {@code index}.
   *
   * @param scene normalized scene
   * @param index cell index
   * @return {@code true} when the sample has data, no cloud/cirrus flag and finite bands
   */
  public static boolean isUsable(Scene scene, int index) {
    if (scene.dataMask() != null && scene.dataMask()[index] == 0) {
      return false;
    }
    if (scene.qa() != null && (scene.qa()[index] & (QA_CLOUD_BIT | QA_CIRRUS_BIT)) != 0) {
      return false;
    }
    for (float[] samples : scene.bands().values()) {
      if (!Float.isFinite(samples[index])) {
        return false;
      }
    }
    return true;
  }

  static Double normalizeCloudFraction(Double raw) {
    if (raw == null || raw.isNaN() || raw < 0) {
      return null;
    }
    if (raw <= 1.0) {
      return raw;
    }
    if (raw <= 100.0) {
      return raw / 100.0;
    }
    return null;
  }
}
