package com.example.secretsync.app;

import com.example.secretsync.core.manifest.Durations;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Runtime settings of the controller process. Each value is read from a system property first,
 * then from the matching environment variable.
 *
 * <table>
 *   <caption>Settings</caption>
 *   <tr><th>Property</th><th>Environment</th><th>Default</th></tr>
 *   <tr><td>secretsync.manifests</td><td>SECRETSYNC_MANIFESTS</td><td>none</td></tr>
 *   <tr><td>secretsync.http.port</td><td>SECRETSYNC_HTTP_PORT</td><td>8080</td></tr>
 *   <tr><td>secretsync.workers</td><td>SECRETSYNC_WORKERS</td><td>4</td></tr>
 *   <tr><td>secretsync.backend.permits</td><td>SECRETSYNC_BACKEND_PERMITS</td><td>8</td></tr>
 *   <tr><td>secretsync.call.timeout</td><td>SECRETSYNC_CALL_TIMEOUT</td><td>10s</td></tr>
 *   <tr><td>secretsync.pass.timeout</td><td>SECRETSYNC_PASS_TIMEOUT</td><td>60s</td></tr>
 *   <tr><td>secretsync.refresh.min</td><td>SECRETSYNC_REFRESH_MIN</td><td>5s</td></tr>
 *   <tr><td>secretsync.health.interval</td><td>SECRETSYNC_HEALTH_INTERVAL</td><td>30s</td></tr>
 *   <tr><td>secretsync.namespace</td><td>SECRETSYNC_NAMESPACE</td><td>default</td></tr>
 * </table>
 */
public record ControllerSettings(
    Optional<Path> manifests,
    int httpPort,
    int workers,
    int backendPermits,
    Duration callTimeout,
    Duration passTimeout,
    Duration minRefreshInterval,
    Duration healthCheckInterval,
    String defaultNamespace) {

  /** Reads settings from system properties and the environment. */
  public static ControllerSettings load() {
    return load(System::getProperty, System::getenv);
  }

  static ControllerSettings load(
      final UnaryOperator<String> properties, final UnaryOperator<String> environment) {
    final var source = new Source(properties, environment);
    return new ControllerSettings(
        source.get("secretsync.manifests", "SECRETSYNC_MANIFESTS").map(Path::of),
        source.integer("secretsync.http.port", "SECRETSYNC_HTTP_PORT", 8080),
        source.integer("secretsync.workers", "SECRETSYNC_WORKERS", 4),
        source.integer("secretsync.backend.permits", "SECRETSYNC_BACKEND_PERMITS", 8),
        source.duration("secretsync.call.timeout", "SECRETSYNC_CALL_TIMEOUT", "10s"),
        source.duration("secretsync.pass.timeout", "SECRETSYNC_PASS_TIMEOUT", "60s"),
        source.duration("secretsync.refresh.min", "SECRETSYNC_REFRESH_MIN", "5s"),
        source.duration("secretsync.health.interval", "SECRETSYNC_HEALTH_INTERVAL", "30s"),
        source.get("secretsync.namespace", "SECRETSYNC_NAMESPACE").orElse("default"));
  }

  private record Source(UnaryOperator<String> properties, UnaryOperator<String> environment) {

    Optional<String> get(final String property, final String variable) {
      return Optional.ofNullable(properties.apply(property))
          .or(() -> Optional.ofNullable(environment.apply(variable)))
          .map(String::strip)
          .filter(value -> !value.isEmpty());
    }

    int integer(final String property, final String variable, final int defaultValue) {
      return get(property, variable)
          .map(
              value -> {
                try {
                  return Integer.parseInt(value);
                } catch (final NumberFormatException e) {
                  throw new IllegalArgumentException(
                      property + " must be an integer but was '" + value + "'", e);
                }
              })
          .orElse(defaultValue);
    }

    Duration duration(final String property, final String variable, final String defaultValue) {
      return Durations.parse(get(property, variable).orElse(defaultValue));
    }
  }
}
