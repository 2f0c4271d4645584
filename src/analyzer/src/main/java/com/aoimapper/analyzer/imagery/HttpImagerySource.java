package com.aoimapper.analyzer.imagery;

import com.aoimapper.analyzer.config.ImageryProperties;
import com.aoimapper.analyzer.model.GeoPoint;
import com.aoimapper.analyzer.pipeline.AnalysisTimeoutException;
import com.aoimapper.analyzer.pipeline.CancellationToken;
import com.aoimapper.analyzer.pipeline.DataUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Imagery source backed by the scene search HTTP API.
 *
 * <p>Each session tracks its in-flight requests; cancelling the run token or closing the
 * session aborts them.
 */
@Component
public class HttpImagerySource implements ImagerySource {
  private static final Logger log = LoggerFactory.getLogger(HttpImagerySource.class);

  private final ImageryProperties properties;
  private final ImageryTokenService tokenService;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Timer searchTimer;
  private final Counter searchSuccessCounter;
  private final Counter searchNotFoundCounter;
  private final Counter searchRateLimitedCounter;
  private final Counter searchClientErrorCounter;
  private final Counter searchServerErrorCounter;
  private final Counter searchExceptionCounter;

  public HttpImagerySource(
      ImageryProperties properties,
      ImageryTokenService tokenService,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.tokenService = tokenService;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;

    this.searchTimer = Timer.builder("analyzer.imagery.search.http.duration")
        .description("Imagery scene search HTTP request duration (seconds)")
        .register(meterRegistry);
    this.searchSuccessCounter = outcomeCounter(meterRegistry, "success");
    this.searchNotFoundCounter = outcomeCounter(meterRegistry, "not_found");
    this.searchRateLimitedCounter = outcomeCounter(meterRegistry, "rate_limited");
    this.searchClientErrorCounter = outcomeCounter(meterRegistry, "client_error");
    this.searchServerErrorCounter = outcomeCounter(meterRegistry, "server_error");
    this.searchExceptionCounter = outcomeCounter(meterRegistry, "exception");
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("analyzer.imagery.search.http.requests.total")
        .description("Imagery scene search HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  @Override
  public ImagerySession openSession() {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new DataUnavailableException("Imagery source base URL is not configured");
    }
    return new HttpSession();
  }

  private final class HttpSession implements ImagerySession {
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();

    @Override
    public List<Scene> search(SceneQuery query, CancellationToken token) {
      if (closed.get()) {
        throw new IllegalStateException("imagery session is closed");
      }
      token.throwIfCancelled();
      String bearer = null;
      if (tokenService.isEnabled()) {
        try {
          bearer = tokenService.getToken(token);
        } catch (ImageryTokenService.TokenRefreshException ex) {
          searchExceptionCounter.increment();
          throw new DataUnavailableException("Imagery source authentication failed: " + ex.getMessage(), ex);
        }
      }
      Duration timeout = effectiveTimeout(token);

      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(URI.create(trimTrailingSlash(properties.baseUrl()) + "/scenes/search"))
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .timeout(timeout)
          .POST(HttpRequest.BodyPublishers.ofString(requestBody(query)));
      if (bearer != null) {
        builder.header("Authorization", "Bearer " + bearer);
      }

      long startNs = System.nanoTime();
      CompletableFuture<HttpResponse<String>> future =
          httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString());
      inFlight.add(future);
      if (closed.get()) {
        future.cancel(true);
      }
      try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
        HttpResponse<String> response = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        return handleResponse(response);
      } catch (TimeoutException ex) {
        future.cancel(true);
        searchExceptionCounter.increment();
        log.warn("Imagery search exceeded {} ms", timeout.toMillis());
        throw token.isExpired() ? token.expired() : new AnalysisTimeoutException(
            "Imagery search exceeded request timeout of " + timeout.toMillis() + " ms", ex);
      } catch (CancellationException ex) {
        searchExceptionCounter.increment();
        throw new AnalysisTimeoutException("Imagery search was cancelled", ex);
      } catch (InterruptedException ex) {
        future.cancel(true);
        Thread.currentThread().interrupt();
        searchExceptionCounter.increment();
        throw new AnalysisTimeoutException("Imagery search interrupted", ex);
      } catch (ExecutionException ex) {
        searchExceptionCounter.increment();
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        if (cause instanceof HttpTimeoutException) {
          throw new AnalysisTimeoutException("Imagery search timed out", cause);
        }
        log.error("Imagery search failed", cause);
        throw new DataUnavailableException("Imagery source request failed: " + cause.getMessage(), cause);
      } finally {
        inFlight.remove(future);
        searchTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
      }
    }

    @Override
    public void close() {
      if (closed.compareAndSet(false, true)) {
        for (CompletableFuture<?> future : inFlight) {
          future.cancel(true);
        }
        inFlight.clear();
      }
    }
  }

  private Duration effectiveTimeout(CancellationToken token) {
    Duration timeout = properties.requestTimeout() == null ? Duration.ofSeconds(90) : properties.requestTimeout();
    if (token.hasDeadline()) {
      Duration remaining = token.remaining();
      if (remaining.isZero()) {
        throw token.expired();
      }
      if (remaining.compareTo(timeout) < 0) {
        timeout = remaining;
      }
    }
    return timeout;
  }

  private List<Scene> handleResponse(HttpResponse<String> response) {
    int status = response.statusCode();
    if (status == 404) {
      searchNotFoundCounter.increment();
      log.info("Imagery source has no scenes for the query (404)");
      return List.of();
    }
    if (status == 429) {
      searchRateLimitedCounter.increment();
      log.warn("Imagery source rate limit hit (429)");
      throw new DataUnavailableException("Imagery source rate limit exceeded");
    }
    if (status >= 400) {
      if (status >= 500) {
        searchServerErrorCounter.increment();
      } else {
        searchClientErrorCounter.increment();
      }
      log.warn("Imagery search failed: status={}", status);
      throw new DataUnavailableException("Imagery source returned HTTP " + status);
    }
    searchSuccessCounter.increment();
    return parseScenes(response.body());
  }

  String requestBody(SceneQuery query) {
    ObjectNode root = objectMapper.createObjectNode();
    ObjectNode geometry = root.putObject("geometry");
    geometry.put("type", "Polygon");
    ArrayNode ring = geometry.putArray("coordinates").addArray();
    for (GeoPoint vertex : query.geometry().vertices()) {
      ring.addArray().add(vertex.longitude()).add(vertex.latitude());
    }
    root.put("date_from", query.dateFrom().toString());
    root.put("date_to", query.dateTo().toString());
    root.put("max_cloud_fraction", query.maxCloudFraction());

    RasterGrid grid = query.grid();
    ObjectNode gridNode = root.putObject("grid");
    gridNode.put("crs", grid.crs());
    gridNode.put("origin_x", grid.originX());
    gridNode.put("origin_y", grid.originY());
    gridNode.put("cell_size", grid.cellSize());
    gridNode.put("columns", grid.columns());
    gridNode.put("rows", grid.rows());

    ArrayNode bands = root.putArray("bands");
    for (SpectralBand band : SpectralBand.values()) {
      if (query.bands().contains(band)) {
        bands.add(band.key());
      }
    }
    try {
      return objectMapper.writeValueAsString(root);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize scene query", ex);
    }
  }

  List<Scene> parseScenes(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new DataUnavailableException("Imagery source returned a malformed response", ex);
    }
    JsonNode scenes = root == null ? null : root.path("scenes");
    if (scenes == null || !scenes.isArray()) {
      throw new DataUnavailableException("Imagery source response has no scenes array");
    }

    List<Scene> results = new ArrayList<>();
    for (JsonNode node : scenes) {
      if (!node.isObject()) {
        continue;
      }
      results.add(parseScene(node));
    }
    return results;
  }

  private Scene parseScene(JsonNode node) {
    Map<SpectralBand, float[]> bands = new EnumMap<>(SpectralBand.class);
    JsonNode bandsNode = node.path("bands");
    for (SpectralBand band : SpectralBand.values()) {
      JsonNode values = bandsNode.get(band.key());
      if (values != null && values.isArray()) {
        float[] samples = new float[values.size()];
        for (int i = 0; i < samples.length; i++) {
          JsonNode sample = values.get(i);
          samples[i] = sample == null || !sample.isNumber() ? Float.NaN : (float) sample.asDouble();
        }
        bands.put(band, samples);
      }
    }

    byte[] dataMask = null;
    JsonNode maskNode = node.get("data_mask");
    if (maskNode != null && maskNode.isArray()) {
      dataMask = new byte[maskNode.size()];
      for (int i = 0; i < dataMask.length; i++) {
        dataMask[i] = (byte) (maskNode.get(i).asInt(0) == 0 ? 0 : 1);
      }
    }

    int[] qa = null;
    JsonNode qaNode = node.get("qa");
    if (qaNode != null && qaNode.isArray()) {
      qa = new int[qaNode.size()];
      for (int i = 0; i < qa.length; i++) {
        qa[i] = qaNode.get(i).asInt(0);
      }
    }

    JsonNode cloud = node.get("cloud_fraction");
    return new Scene(
        text(node, "id"),
        instant(node, "acquired"),
        cloud == null || !cloud.isNumber() ? null : cloud.asDouble(),
        bands,
        dataMask,
        qa);
  }

  private String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText().trim();
  }

  private Instant instant(JsonNode node, String field) {
    String value = text(node, field);
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      log.debug("Unable to parse scene acquisition time: {}", value);
      return null;
    }
  }

  private static String trimTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
