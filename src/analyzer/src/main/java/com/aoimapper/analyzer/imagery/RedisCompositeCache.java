package com.aoimapper.analyzer.imagery;

import com.aoimapper.analyzer.config.ImageryProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed composite cache.
 *
 * <p>Entries expire with the configured freshness window and also carry their write time, so a
 * stale entry is never served even if its TTL was extended externally. Redis failures degrade
 * to a cache miss.
 */
public class RedisCompositeCache implements CompositeCache {
  private static final Logger log = LoggerFactory.getLogger(RedisCompositeCache.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final ImageryProperties.Cache properties;
  private final Clock clock;

  record CachedComposite(
      long cachedAtEpochMs,
      RasterGrid grid,
      Map<String, float[]> bands,
      boolean[] valid,
      int sceneCount) {}

  public RedisCompositeCache(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      ImageryProperties.Cache properties,
      Clock clock) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public Optional<RasterComposite> get(String fingerprint) {
    String key = key(fingerprint);
    try {
      String payload = redisTemplate.opsForValue().get(key);
      if (payload == null) {
        return Optional.empty();
      }
      CachedComposite cached = objectMapper.readValue(payload, CachedComposite.class);
      long ageMs = clock.millis() - cached.cachedAtEpochMs();
      if (ageMs < 0 || ageMs > freshness().toMillis()) {
        log.debug("Ignoring stale composite {} (age {} ms)", key, ageMs);
        return Optional.empty();
      }
      EnumMap<SpectralBand, float[]> bands = new EnumMap<>(SpectralBand.class);
      for (SpectralBand band : SpectralBand.values()) {
        bands.put(band, cached.bands().get(band.key()));
      }
      return Optional.of(new RasterComposite(cached.grid(), bands, cached.valid(), cached.sceneCount()));
    } catch (Exception ex) {
      log.warn("Unable to read cached composite {}, fetching from source", key, ex);
      return Optional.empty();
    }
  }

  @Override
  public void put(String fingerprint, RasterComposite composite) {
    String key = key(fingerprint);
    try {
      Map<String, float[]> bands = new LinkedHashMap<>();
      composite.bands().forEach((band, values) -> bands.put(band.key(), values));
      CachedComposite cached = new CachedComposite(
          clock.millis(), composite.grid(), bands, composite.valid(), composite.sceneCount());
      redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(cached), freshness());
    } catch (Exception ex) {
      log.warn("Unable to cache composite {}", key, ex);
    }
  }

  private String key(String fingerprint) {
    String prefix = properties.keyPrefix() == null ? "" : properties.keyPrefix();
    return prefix + fingerprint;
  }

  private Duration freshness() {
    return properties.freshness() == null ? Duration.ofHours(6) : properties.freshness();
  }
}
