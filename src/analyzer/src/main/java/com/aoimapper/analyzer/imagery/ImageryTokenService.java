package com.aoimapper.analyzer.imagery;

import com.aoimapper.analyzer.config.ImageryProperties;
import com.aoimapper.analyzer.pipeline.AnalysisTimeoutException;
import com.aoimapper.analyzer.pipeline.CancellationToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * OAuth2 client-credentials token cache for the imagery source.
 *
 * <p>Tokens are reused until shortly before expiry. After a failed refresh, further attempts
 * are refused for an increasing cooldown. The service lock guards the cached state only; it is
 * not held while a token request is in flight.
 */
@Component
public class ImageryTokenService {
  private static final Logger log = LoggerFactory.getLogger(ImageryTokenService.class);
  private static final long[] TOKEN_FAILURE_BACKOFF_SECONDS = {5L, 15L, 30L, 60L, 120L, 300L};
  private static final Duration TOKEN_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final ImageryProperties properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Timer tokenRequestTimer;
  private final Counter tokenSuccessCounter;
  private final Counter tokenFailureCounter;

  private String accessToken;
  private Instant expiry;
  private int tokenFailureCount;
  private Instant nextTokenAttemptAt = Instant.EPOCH;

  public static class TokenRefreshException extends RuntimeException {
    private TokenRefreshException(String message) {
      super(message);
    }

    private TokenRefreshException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public ImageryTokenService(
      ImageryProperties properties,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;

    this.tokenRequestTimer = Timer.builder("analyzer.imagery.token.http.duration")
        .description("Imagery token HTTP request duration (seconds)")
        .register(meterRegistry);
    this.tokenSuccessCounter = Counter.builder("analyzer.imagery.token.http.requests.total")
        .description("Imagery token HTTP requests (by outcome)")
        .tag("outcome", "success")
        .register(meterRegistry);
    this.tokenFailureCounter = Counter.builder("analyzer.imagery.token.http.requests.total")
        .description("Imagery token HTTP requests (by outcome)")
        .tag("outcome", "failure")
        .register(meterRegistry);
  }

  /**
   * Whether the imagery source requires a bearer token.
   *
   * @return {@code true} when client credentials and a token URL are configured
   */
  public boolean isEnabled() {
    return properties.hasCredentials() && properties.tokenUrl() != null && !properties.tokenUrl().isBlank();
  }

  /**
   * Returns a valid access token, requesting a new one when the cached token is near expiry.
   *
   * <p>The token request is bounded by the caller's deadline and aborted when {@code token} is
   * cancelled. Such aborts surface as {@link AnalysisTimeoutException} and do not start the
   * failure cooldown.
   *
   * @param token caller cancellation and deadline
   * @return bearer token
   * @throws TokenRefreshException when the endpoint fails or the cooldown is active
   */
  public String getToken(CancellationToken token) {
    synchronized (this) {
      if (accessToken != null && expiry != null && expiry.isAfter(Instant.now().plusSeconds(15))) {
        return accessToken;
      }

      Instant now = Instant.now();
      if (now.isBefore(nextTokenAttemptAt)) {
        long waitSeconds = Math.max(1L, Duration.between(now, nextTokenAttemptAt).toSeconds());
        throw new TokenRefreshException("Token refresh cooldown active (" + waitSeconds + "s remaining)");
      }
    }
    if (!isEnabled()) {
      throw new IllegalStateException("Imagery credentials missing (IMAGERY_CLIENT_ID, IMAGERY_CLIENT_SECRET, IMAGERY_TOKEN_URL)");
    }
    token.throwIfCancelled();
    Duration timeout = requestTimeout(token);

    String body = "grant_type=client_credentials&client_id="
        + URLEncoder.encode(properties.clientId(), StandardCharsets.UTF_8)
        + "&client_secret=" + URLEncoder.encode(properties.clientSecret(), StandardCharsets.UTF_8);
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(properties.tokenUrl()))
        .header("Content-Type", "application/x-www-form-urlencoded")
        .timeout(timeout)
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build();

    long startNs = System.nanoTime();
    CompletableFuture<HttpResponse<String>> future =
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
    try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
      HttpResponse<String> response = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      return accept(response);
    } catch (TokenRefreshException ex) {
      log.error("Failed to get imagery token", ex);
      throw ex;
    } catch (JsonProcessingException ex) {
      TokenRefreshException failure = registerFailure("token response is not valid JSON", ex);
      log.error("Failed to get imagery token", failure);
      throw failure;
    } catch (TimeoutException ex) {
      future.cancel(true);
      if (token.isExpired()) {
        log.warn("Imagery token request abandoned at the caller deadline");
        throw token.expired();
      }
      TokenRefreshException failure = registerFailure("token request timed out after " + timeout.toMillis() + " ms", ex);
      log.error("Failed to get imagery token", failure);
      throw failure;
    } catch (CancellationException ex) {
      log.warn("Imagery token request cancelled");
      throw new AnalysisTimeoutException("Imagery token request was cancelled", ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      TokenRefreshException failure = registerFailure("token request interrupted", ex);
      log.error("Failed to get imagery token", failure);
      throw failure;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof HttpTimeoutException && token.isExpired()) {
        throw token.expired();
      }
      TokenRefreshException failure = registerFailure("token request failed: " + cause.getMessage(), cause);
      log.error("Failed to get imagery token", failure);
      throw failure;
    } finally {
      tokenRequestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
    }
  }

  private Duration requestTimeout(CancellationToken token) {
    if (!token.hasDeadline()) {
      return TOKEN_REQUEST_TIMEOUT;
    }
    Duration remaining = token.remaining();
    if (remaining.isZero()) {
      throw token.expired();
    }
    return remaining.compareTo(TOKEN_REQUEST_TIMEOUT) < 0 ? remaining : TOKEN_REQUEST_TIMEOUT;
  }

  private synchronized String accept(HttpResponse<String> response) throws JsonProcessingException {
    if (response.statusCode() != 200) {
      throw registerFailure("token endpoint returned " + response.statusCode(), null);
    }
    JsonNode json = objectMapper.readTree(response.body());
    JsonNode token = json == null ? null : json.get("access_token");
    if (token == null || token.asText().isBlank()) {
      throw registerFailure("token response has no access_token", null);
    }
    accessToken = token.asText();
    long expiresIn = json.path("expires_in").asLong(300L);
    expiry = Instant.now().plusSeconds(expiresIn);
    tokenFailureCount = 0;
    nextTokenAttemptAt = Instant.EPOCH;
    tokenSuccessCounter.increment();

    log.info("Imagery token refreshed, expires in {} seconds", expiresIn);
    return accessToken;
  }

  private synchronized TokenRefreshException registerFailure(String message, Throwable cause) {
    tokenFailureCounter.increment();
    tokenFailureCount++;
    int index = Math.min(tokenFailureCount - 1, TOKEN_FAILURE_BACKOFF_SECONDS.length - 1);
    long cooldownSeconds = TOKEN_FAILURE_BACKOFF_SECONDS[index];
    nextTokenAttemptAt = Instant.now().plusSeconds(cooldownSeconds);
    log.warn("Imagery token refresh failed (attempt {}), cooldown {}s", tokenFailureCount, cooldownSeconds);
    if (cause == null) {
      return new TokenRefreshException("Token refresh failed: " + message);
    }
    return new TokenRefreshException("Token refresh failed: " + message, cause);
  }
}
