package com.aoimapper.analyzer.config;

import com.aoimapper.analyzer.imagery.CompositeCache;
import com.aoimapper.analyzer.imagery.NoopCompositeCache;
import com.aoimapper.analyzer.imagery.RedisCompositeCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class AppConfig {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  @Bean
  public HttpClient httpClient() {
    return HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public CompositeCache compositeCache(
      ImageryProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplate,
      ObjectMapper objectMapper,
      Clock clock) {
    ImageryProperties.Cache cache = properties.cache();
    if (cache == null || !cache.enabled()) {
      return new NoopCompositeCache();
    }
    // Composites are only cached when Redis is explicitly enabled for it.
    log.info("Composite cache enabled: prefix={}, freshness={}", cache.keyPrefix(), cache.freshness());
    return new RedisCompositeCache(redisTemplate.getObject(), objectMapper, cache, clock);
  }
}
