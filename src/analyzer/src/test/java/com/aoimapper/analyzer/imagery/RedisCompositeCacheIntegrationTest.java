package com.aoimapper.analyzer.imagery;

import static org.assertj.core.api.Assertions.assertThat;

import com.aoimapper.analyzer.config.ImageryProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class RedisCompositeCacheIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>("redis:7.2-alpine").withExposedPorts(6379);

  private static final Instant WRITTEN_AT = Instant.parse("2026-03-01T08:00:00Z");

  private static LettuceConnectionFactory connectionFactory;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ImageryProperties.Cache cacheProperties =
      new ImageryProperties.Cache(true, "aoimapper:composite:", Duration.ofHours(6));
  private StringRedisTemplate redisTemplate;

  @BeforeAll
  static void setupRedis() {
    RedisStandaloneConfiguration config =
        new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379));
    connectionFactory = new LettuceConnectionFactory(config);
    connectionFactory.afterPropertiesSet();
  }

  @AfterAll
  static void shutdownRedis() {
    if (connectionFactory != null) {
      connectionFactory.destroy();
    }
  }

  @BeforeEach
  void clearRedis() {
    redisTemplate = new StringRedisTemplate(connectionFactory);
    redisTemplate.afterPropertiesSet();
    try (RedisConnection connection = connectionFactory.getConnection()) {
      connection.serverCommands().flushAll();
    }
  }

  @Test
  void storedCompositeIsReturnedWithinFreshnessWindow() {
    RedisCompositeCache writer = cacheAt(WRITTEN_AT);
    writer.put("abc123", composite());

    Optional<RasterComposite> cached = cacheAt(WRITTEN_AT.plus(Duration.ofHours(1))).get("abc123");

    assertThat(cached).isPresent();
    RasterComposite composite = cached.get();
    assertThat(composite.grid()).isEqualTo(grid());
    assertThat(composite.sceneCount()).isEqualTo(3);
    assertThat(composite.valid()).containsExactly(true, true, false, true);
    assertThat(composite.bands().get(SpectralBand.NIR)).containsExactly(0.5f, 0.45f, 0.0f, 0.4f);
    assertThat(composite.bands().get(SpectralBand.SWIR)).containsExactly(0.2f, 0.21f, 0.0f, 0.22f);
  }

  @Test
  void entriesAreStoredUnderPrefixedKeyWithTtl() {
    cacheAt(WRITTEN_AT).put("abc123", composite());

    assertThat(redisTemplate.hasKey("aoimapper:composite:abc123")).isTrue();
    Long ttl = redisTemplate.getExpire("aoimapper:composite:abc123");
    assertThat(ttl).isNotNull();
    assertThat(ttl).isPositive().isLessThanOrEqualTo(Duration.ofHours(6).toSeconds());
  }

  @Test
  void staleEntryIsIgnored() {
    cacheAt(WRITTEN_AT).put("abc123", composite());

    assertThat(cacheAt(WRITTEN_AT.plus(Duration.ofHours(7))).get("abc123")).isEmpty();
  }

  @Test
  void missingOrCorruptEntryIsAMiss() {
    redisTemplate.opsForValue().set("aoimapper:composite:broken", "{not json");

    RedisCompositeCache cache = cacheAt(WRITTEN_AT);

    assertThat(cache.get("absent")).isEmpty();
    assertThat(cache.get("broken")).isEmpty();
  }

  private RedisCompositeCache cacheAt(Instant now) {
    return new RedisCompositeCache(
        redisTemplate, objectMapper, cacheProperties, Clock.fixed(now, ZoneOffset.UTC));
  }

  private static RasterGrid grid() {
    return new RasterGrid("+proj=laea +lat_0=17.385 +lon_0=78.4867", -10.0, 10.0, 10.0, 2, 2);
  }

  private static RasterComposite composite() {
    Map<SpectralBand, float[]> bands = new EnumMap<>(SpectralBand.class);
    bands.put(SpectralBand.RED, new float[] {0.05f, 0.06f, 0f, 0.07f});
    bands.put(SpectralBand.GREEN, new float[] {0.08f, 0.09f, 0f, 0.1f});
    bands.put(SpectralBand.BLUE, new float[] {0.04f, 0.04f, 0f, 0.05f});
    bands.put(SpectralBand.NIR, new float[] {0.5f, 0.45f, 0f, 0.4f});
    bands.put(SpectralBand.SWIR, new float[] {0.2f, 0.21f, 0f, 0.22f});
    return new RasterComposite(grid(), bands, new boolean[] {true, true, false, true}, 3);
  }
}
