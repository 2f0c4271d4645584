package com.aoimapper.analyzer.imagery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aoimapper.analyzer.config.ImageryProperties;
import com.aoimapper.analyzer.pipeline.AnalysisException;
import com.aoimapper.analyzer.pipeline.AnalysisTimeoutException;
import com.aoimapper.analyzer.pipeline.CancellationToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

class ImageryTokenServiceTest {

  @Test
  void getTokenReinterruptsThreadWhenWaitIsInterrupted() {
    HttpClient httpClient = mock(HttpClient.class);
    when(httpClient.sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(new CompletableFuture<>());

    ImageryTokenService service = service(credentials("client-id", "client-secret"), httpClient);

    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> service.getToken(CancellationToken.none()))
          .isInstanceOf(ImageryTokenService.TokenRefreshException.class)
          .hasMessageContaining("interrupted");
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void getTokenPostsClientCredentialsForm() {
    HttpClient httpClient = mock(HttpClient.class);
    respondWith(httpClient, 200, "{\"access_token\":\"abc\",\"expires_in\":300}");

    String token = service(credentials("client-id", "s3cr&t"), httpClient).getToken(CancellationToken.none());

    assertThat(token).isEqualTo("abc");
    ArgumentCaptor<HttpRequest> requestCaptor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).sendAsync(requestCaptor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    HttpRequest request = requestCaptor.getValue();
    assertThat(request.uri().toString()).isEqualTo("https://auth.example/token");
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.headers().allValues("Content-Type"))
        .containsExactly("application/x-www-form-urlencoded");
    assertThat(request.timeout()).contains(Duration.ofSeconds(30));
  }

  @Test
  void getTokenUsesCachedTokenWithoutSecondHttpCall() {
    HttpClient httpClient = mock(HttpClient.class);
    respondWith(httpClient, 200, "{\"access_token\":\"cached\",\"expires_in\":3600}");

    ImageryTokenService service = service(credentials("client-id", "client-secret"), httpClient);

    assertThat(service.getToken(CancellationToken.none())).isEqualTo("cached");
    assertThat(service.getToken(CancellationToken.none())).isEqualTo("cached");
    verify(httpClient, times(1))
        .sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void getTokenAppliesCooldownAfterFailure() {
    HttpClient httpClient = mock(HttpClient.class);
    respondWith(httpClient, 500, "{\"error\":\"upstream\"}");

    ImageryTokenService service = service(credentials("client-id", "client-secret"), httpClient);

    assertThatThrownBy(() -> service.getToken(CancellationToken.none()))
        .isInstanceOf(ImageryTokenService.TokenRefreshException.class)
        .hasMessageContaining("Token refresh failed");
    assertThatThrownBy(() -> service.getToken(CancellationToken.none()))
        .isInstanceOf(ImageryTokenService.TokenRefreshException.class)
        .hasMessageContaining("cooldown active");
    verify(httpClient, times(1))
        .sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void tokenWithoutAccessTokenFieldIsRejected() {
    HttpClient httpClient = mock(HttpClient.class);
    respondWith(httpClient, 200, "{\"token_type\":\"bearer\"}");

    ImageryTokenService service = service(credentials("client-id", "client-secret"), httpClient);

    assertThatThrownBy(() -> service.getToken(CancellationToken.none()))
        .isInstanceOf(ImageryTokenService.TokenRefreshException.class)
        .hasMessageContaining("no access_token");
  }

  @Test
  void slowEndpointIsAbandonedAtCallerDeadlineWithoutCooldown() {
    HttpClient httpClient = mock(HttpClient.class);
    CompletableFuture<HttpResponse<String>> slow = new CompletableFuture<>();
    CompletableFuture<HttpResponse<String>> fast = CompletableFuture.completedFuture(
        response(200, "{\"access_token\":\"late\",\"expires_in\":300}"));
    when(httpClient.sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(slow, fast);
    ImageryTokenService service = service(credentials("client-id", "client-secret"), httpClient);

    long startNs = System.nanoTime();
    assertThatThrownBy(() -> service.getToken(CancellationToken.withTimeout(Duration.ofMillis(200))))
        .isInstanceOf(AnalysisTimeoutException.class);

    assertThat(Duration.ofNanos(System.nanoTime() - startNs)).isLessThan(Duration.ofSeconds(2));
    assertThat(slow.isCancelled()).isTrue();
    assertThat(service.getToken(CancellationToken.none())).isEqualTo("late");
  }

  @Test
  void tokenRequestTimeoutIsBoundedByCallerDeadline() {
    HttpClient httpClient = mock(HttpClient.class);
    respondWith(httpClient, 200, "{\"access_token\":\"abc\",\"expires_in\":300}");

    service(credentials("client-id", "client-secret"), httpClient)
        .getToken(CancellationToken.withTimeout(Duration.ofSeconds(5)));

    ArgumentCaptor<HttpRequest> requestCaptor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).sendAsync(requestCaptor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(requestCaptor.getValue().timeout().get()).isLessThanOrEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void cancellingCallerAbortsTokenRequest() throws Exception {
    HttpClient httpClient = mock(HttpClient.class);
    CompletableFuture<HttpResponse<String>> pending = new CompletableFuture<>();
    when(httpClient.sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(pending);
    ImageryTokenService service = service(credentials("client-id", "client-secret"), httpClient);
    CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(30));

    CompletableFuture<Throwable> outcome = CompletableFuture.supplyAsync(() -> {
      try {
        service.getToken(token);
        return null;
      } catch (AnalysisException ex) {
        return ex;
      }
    });
    verify(httpClient, timeout(5_000))
        .sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    token.cancel("caller disconnected");

    assertThat(outcome.get(5, TimeUnit.SECONDS)).isInstanceOf(AnalysisTimeoutException.class);
    assertThat(pending.isCancelled()).isTrue();
  }

  @Test
  void pendingRefreshDoesNotBlockOtherCallers() throws Exception {
    HttpClient httpClient = mock(HttpClient.class);
    CompletableFuture<HttpResponse<String>> first = new CompletableFuture<>();
    CompletableFuture<HttpResponse<String>> second = new CompletableFuture<>();
    when(httpClient.sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(first, second);
    ImageryTokenService service = service(credentials("client-id", "client-secret"), httpClient);
    CancellationToken slowCaller = CancellationToken.withTimeout(Duration.ofSeconds(30));

    CompletableFuture<Throwable> background = CompletableFuture.supplyAsync(() -> {
      try {
        service.getToken(slowCaller);
        return null;
      } catch (AnalysisException ex) {
        return ex;
      }
    });
    verify(httpClient, timeout(5_000))
        .sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());

    long startNs = System.nanoTime();
    assertThatThrownBy(() -> service.getToken(CancellationToken.withTimeout(Duration.ofMillis(150))))
        .isInstanceOf(AnalysisTimeoutException.class);
    assertThat(Duration.ofNanos(System.nanoTime() - startNs)).isLessThan(Duration.ofSeconds(2));

    slowCaller.cancel("test finished");
    assertThat(background.get(5, TimeUnit.SECONDS)).isInstanceOf(AnalysisTimeoutException.class);
  }

  @Test
  void disabledWithoutCredentials() {
    ImageryTokenService service = service(credentials(null, null), mock(HttpClient.class));

    assertThat(service.isEnabled()).isFalse();
    assertThatThrownBy(() -> service.getToken(CancellationToken.none())).isInstanceOf(IllegalStateException.class);
  }

  private static ImageryProperties credentials(String clientId, String clientSecret) {
    return new ImageryProperties(
        "https://imagery.example/api",
        "https://auth.example/token",
        clientId,
        clientSecret,
        365,
        0.4,
        Duration.ofSeconds(90),
        new ImageryProperties.Cache(false, "aoimapper:composite:", Duration.ofHours(6)));
  }

  private static ImageryTokenService service(ImageryProperties properties, HttpClient httpClient) {
    return new ImageryTokenService(properties, new SimpleMeterRegistry(), httpClient, new ObjectMapper());
  }

  private static HttpResponse<String> response(int status, String body) {
    @SuppressWarnings("unchecked")
    HttpResponse<String> response = (HttpResponse<String>) mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    return response;
  }

  private static void respondWith(HttpClient httpClient, int status, String body) {
    HttpResponse<String> response = response(status, body);
    when(httpClient.sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(CompletableFuture.completedFuture(response));
  }
}
