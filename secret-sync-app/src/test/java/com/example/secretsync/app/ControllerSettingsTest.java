package com.example.secretsync.app;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ControllerSettingsTest {

  private static ControllerSettings load(
      final Map<String, String> properties, final Map<String, String> environment) {
    return ControllerSettings.load(properties::get, environment::get);
  }

  @Test
  @DisplayName("Should fall back to defaults when nothing is set")
  void defaults() {
    final var settings = load(Map.of(), Map.of());

    assertEquals(Optional.empty(), settings.manifests());
    assertEquals(8080, settings.httpPort());
    assertEquals(4, settings.workers());
    assertEquals(8, settings.backendPermits());
    assertEquals(Duration.ofSeconds(10), settings.callTimeout());
    assertEquals(Duration.ofSeconds(60), settings.passTimeout());
    assertEquals(Duration.ofSeconds(5), settings.minRefreshInterval());
    assertEquals(Duration.ofSeconds(30), settings.healthCheckInterval());
    assertEquals("default", settings.defaultNamespace());
  }

  @Test
  @DisplayName("Should read environment variables")
  void environment() {
    final var settings =
        load(
            Map.of(),
            Map.of(
                "SECRETSYNC_MANIFESTS", "/etc/secret-sync/manifests",
                "SECRETSYNC_HTTP_PORT", "9090",
                "SECRETSYNC_CALL_TIMEOUT", "2s500ms",
                "SECRETSYNC_NAMESPACE", "payments"));

    assertEquals(Optional.of(Path.of("/etc/secret-sync/manifests")), settings.manifests());
    assertEquals(9090, settings.httpPort());
    assertEquals(Duration.ofMillis(2500), settings.callTimeout());
    assertEquals("payments", settings.defaultNamespace());
  }

  @Test
  @DisplayName("Should prefer system properties over environment variables")
  void propertiesWin() {
    final var settings =
        load(
            Map.of("secretsync.workers", "12", "secretsync.health.interval", "1m"),
            Map.of("SECRETSYNC_WORKERS", "3", "SECRETSYNC_HEALTH_INTERVAL", "5s"));

    assertEquals(12, settings.workers());
    assertEquals(Duration.ofMinutes(1), settings.healthCheckInterval());
  }

  @Test
  @DisplayName("Should ignore blank values")
  void blankValues() {
    final var settings =
        load(Map.of("secretsync.http.port", "  "), Map.of("SECRETSYNC_MANIFESTS", ""));

    assertEquals(8080, settings.httpPort());
    assertTrue(settings.manifests().isEmpty());
  }

  @Test
  @DisplayName("Should reject malformed numbers and durations")
  void malformed() {
    final var number =
        assertThrows(
            IllegalArgumentException.class,
            () -> load(Map.of("secretsync.workers", "four"), Map.of()));
    assertTrue(number.getMessage().contains("secretsync.workers"));

    assertThrows(
        IllegalArgumentException.class,
        () -> load(Map.of(), Map.of("SECRETSYNC_PASS_TIMEOUT", "60")));
  }
}
