package com.example.secretsync.app;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsync.core.SecretSyncController;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Pull-based HTTP endpoint of the controller.
 *
 * <ul>
 *   <li>{@code GET /metrics}: Prometheus text exposition
 *   <li>{@code GET /status}: JSON status of every descriptor and backend, without secret material
 *   <li>{@code GET /healthz}: liveness probe
 * </ul>
 */
public final class ControllerHttpServer implements AutoCloseable {

  private static final System.Logger LOGGER =
      System.getLogger(ControllerHttpServer.class.getName());

  private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

  private final SecretSyncController controller;
  private final PrometheusMeterRegistry prometheus;
  private final ObjectMapper mapper = new ObjectMapper();
  private final HttpServer server;
  private final ExecutorService executor;

  public ControllerHttpServer(
      final SecretSyncController controller,
      final PrometheusMeterRegistry prometheus,
      final int port)
      throws IOException {
    this.controller = controller;
    this.prometheus = prometheus;
    this.server = HttpServer.create(new InetSocketAddress(port), 0);
    server.createContext("/metrics", exchange -> respond(exchange, this::metrics));
    server.createContext("/status", exchange -> respond(exchange, this::status));
    server.createContext("/healthz", exchange -> respond(exchange, () -> text(200, "ok")));
    this.executor =
        Executors.newFixedThreadPool(
            2,
            r -> {
              var t = new Thread(r, "secret-sync-http");
              t.setDaemon(true);
              return t;
            });
    server.setExecutor(executor);
  }

  public void start() {
    server.start();
    LOGGER.log(INFO, "HTTP endpoint listening on port {0}", port());
  }

  /** Bound port, useful when constructed with port 0. */
  public int port() {
    return server.getAddress().getPort();
  }

  @Override
  public void close() {
    server.stop(0);
    executor.shutdownNow();
  }

  private record Response(int status, String contentType, byte[] body) {}

  @FunctionalInterface
  private interface Handler {
    Response handle() throws IOException;
  }

  private void respond(final HttpExchange exchange, final Handler handler) throws IOException {
    try {
      Response response;
      if (!"GET".equals(exchange.getRequestMethod())) {
        response = text(405, "method not allowed");
      } else {
        try {
          response = handler.handle();
        } catch (final IOException | RuntimeException e) {
          LOGGER.log(WARNING, "Failed to serve " + exchange.getRequestURI(), e);
          response = text(500, "internal error");
        }
      }
      exchange.getResponseHeaders().set("Content-Type", response.contentType());
      exchange.sendResponseHeaders(response.status(), response.body().length);
      exchange.getResponseBody().write(response.body());
    } finally {
      exchange.close();
    }
  }

  private Response metrics() {
    return new Response(
        200, PROMETHEUS_CONTENT_TYPE, prometheus.scrape().getBytes(StandardCharsets.UTF_8));
  }

  private Response status() throws IOException {
    final var root = mapper.createObjectNode();
    final var descriptors = root.putArray("descriptors");
    controller
        .statuses()
        .forEach(
            (identity, status) -> {
              final ObjectNode node = descriptors.addObject();
              node.put("identity", identity.toString());
              node.put("status", status.status().name());
              node.put("phase", status.phase().name());
              node.put(
                  "lastSyncTime",
                  status.lastSyncTime() == null ? null : status.lastSyncTime().toString());
              node.put(
                  "errorReason",
                  status.errorReason() == null ? null : status.errorReason().name());
              node.put("errorMessage", status.errorMessage());
              node.put("contentHash", status.contentHash());
              node.put("consecutiveFailures", status.consecutiveFailures());
            });
    final var backends = root.putObject("backends");
    controller.backendHealth().forEach((key, health) -> backends.put(key, health.name()));
    return new Response(200, "application/json", mapper.writeValueAsBytes(root));
  }

  private static Response text(final int status, final String body) {
    return new Response(status, "text/plain", body.getBytes(StandardCharsets.UTF_8));
  }
}
