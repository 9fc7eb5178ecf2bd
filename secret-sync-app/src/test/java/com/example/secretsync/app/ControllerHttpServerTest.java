package com.example.secretsync.app;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.secretsync.core.ErrorReason;
import com.example.secretsync.core.SecretSyncController;
import com.example.secretsync.core.metrics.SyncMetrics;
import com.example.secretsync.core.model.BackendHealth;
import com.example.secretsync.core.model.DescriptorStatus;
import com.example.secretsync.core.model.SecretIdentity;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ControllerHttpServerTest {

  private static final SecretIdentity DB = SecretIdentity.of("payments", "db-credentials");
  private static final SecretIdentity API = SecretIdentity.of("payments", "api");

  private final HttpClient client = HttpClient.newHttpClient();
  private final ObjectMapper mapper = new ObjectMapper();
  private PrometheusMeterRegistry prometheus;
  private SecretSyncController controller;
  private ControllerHttpServer server;

  @BeforeEach
  void setUp() throws IOException {
    prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    controller = mock(SecretSyncController.class);
    server = new ControllerHttpServer(controller, prometheus, 0);
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  private HttpResponse<String> get(final String path) throws IOException, InterruptedException {
    return send(HttpRequest.newBuilder(uri(path)).GET());
  }

  private HttpResponse<String> send(final HttpRequest.Builder request)
      throws IOException, InterruptedException {
    return client.send(
        request.timeout(Duration.ofSeconds(5)).build(), HttpResponse.BodyHandlers.ofString());
  }

  private URI uri(final String path) {
    return URI.create("http://127.0.0.1:" + server.port() + path);
  }

  @Test
  @DisplayName("Should bind an ephemeral port")
  void port() {
    assertTrue(server.port() > 0);
  }

  @Test
  @DisplayName("Should answer the liveness probe")
  void healthz() throws Exception {
    final var response = get("/healthz");

    assertEquals(200, response.statusCode());
    assertEquals("ok", response.body());
  }

  @Test
  @DisplayName("Should expose sync metrics in Prometheus format")
  void metrics() throws Exception {
    new SyncMetrics(prometheus).syncSucceeded(DB, Duration.ofMillis(12));

    final var response = get("/metrics");

    assertEquals(200, response.statusCode());
    assertTrue(
        response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
    assertTrue(response.body().contains("secretsync_sync_success_total"));
    assertTrue(response.body().contains("payments/db-credentials"));
  }

  @Test
  @DisplayName("Should report descriptor and backend status as JSON")
  void status() throws Exception {
    final var at = Instant.parse("2024-05-01T12:00:00Z");
    final var statuses = new LinkedHashMap<SecretIdentity, DescriptorStatus>();
    statuses.put(API, DescriptorStatus.pending().failed(ErrorReason.NOT_FOUND, "api/keys"));
    statuses.put(DB, DescriptorStatus.pending().synced(at, "abc123"));
    when(controller.statuses()).thenReturn(statuses);
    when(controller.backendHealth())
        .thenReturn(Map.of("cluster/vault", BackendHealth.HEALTHY));

    final var response = get("/status");

    assertEquals(200, response.statusCode());
    assertEquals("application/json", response.headers().firstValue("Content-Type").orElse(""));
    final var root = mapper.readTree(response.body());
    final var descriptors = root.get("descriptors");
    assertEquals(2, descriptors.size());

    final var api = descriptors.get(0);
    assertEquals("payments/api", api.get("identity").asText());
    assertEquals("ERROR", api.get("status").asText());
    assertEquals("NOT_FOUND", api.get("errorReason").asText());
    assertEquals(1, api.get("consecutiveFailures").asInt());
    assertTrue(api.get("lastSyncTime").isNull());

    final var db = descriptors.get(1);
    assertEquals("SYNCED", db.get("status").asText());
    assertEquals("2024-05-01T12:00:00Z", db.get("lastSyncTime").asText());
    assertEquals("abc123", db.get("contentHash").asText());
    assertTrue(db.get("errorReason").isNull());

    assertEquals("HEALTHY", root.get("backends").get("cluster/vault").asText());
  }

  @Test
  @DisplayName("Should answer 500 when status collection fails")
  void statusFailure() throws Exception {
    when(controller.statuses()).thenThrow(new IllegalStateException("boom"));

    final var response = get("/status");

    assertEquals(500, response.statusCode());
    assertEquals("internal error", response.body());
  }

  @Test
  @DisplayName("Should reject methods other than GET")
  void methodNotAllowed() throws Exception {
    final var response =
        send(HttpRequest.newBuilder(uri("/healthz")).POST(HttpRequest.BodyPublishers.noBody()));

    assertEquals(405, response.statusCode());
    verifyNoInteractions(controller);
  }
}
