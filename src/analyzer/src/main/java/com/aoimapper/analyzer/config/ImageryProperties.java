package com.aoimapper.analyzer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "imagery")
public record ImageryProperties(
    String baseUrl,
    String tokenUrl,
    String clientId,
    String clientSecret,
    int lookbackDays,
    double maxCloudFraction,
    Duration requestTimeout,
    Cache cache) {
  public record Cache(boolean enabled, String keyPrefix, Duration freshness) {}

  public boolean hasCredentials() {
    return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
  }
}
