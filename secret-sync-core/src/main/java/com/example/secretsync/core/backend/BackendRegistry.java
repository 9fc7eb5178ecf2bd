package com.example.secretsync.core.backend;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsync.core.metrics.SyncMetrics;
import com.example.secretsync.core.model.BackendHealth;
import com.example.secretsync.core.model.BackendKind;
import com.example.secretsync.core.model.BackendRef;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the client and concurrency limiter bound to every configured backend.
 *
 * <p>The client implementation is chosen once per {@link BackendRef} by its kind when the backend
 * is registered; callers then hold the {@link Binding} without dispatching on kind again.
 */
public final class BackendRegistry implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(BackendRegistry.class.getName());

  private final Map<BackendKind, BackendClientFactory> factories;
  private final int defaultPermits;
  private final SyncMetrics metrics;
  private final ConcurrentHashMap<String, Binding> bindings = new ConcurrentHashMap<>();

  /**
   * A backend ready for use: its configuration, its client and its shared limiter.
   *
   * @param ref backend configuration
   * @param client client bound to {@code ref}
   * @param limiter limiter shared by every descriptor using this backend
   */
  public record Binding(BackendRef ref, BackendClient client, BackendLimiter limiter) {

    public ResolvedSecretValue fetch(
        final String remoteKey, final String property, final Duration wait) {
      return limiter.call(wait, () -> client.fetch(remoteKey, property));
    }

    public List<String> listKeys(final String prefix, final Duration wait) {
      return limiter.call(wait, () -> client.listKeys(prefix));
    }
  }

  public BackendRegistry(
      final Map<BackendKind, BackendClientFactory> factories,
      final int defaultPermits,
      final SyncMetrics metrics) {
    if (defaultPermits < 1) throw new IllegalArgumentException("defaultPermits must be >= 1");
    this.factories = new EnumMap<>(factories);
    this.defaultPermits = defaultPermits;
    this.metrics = metrics;
  }

  /** Whether backends of {@code kind} can be registered. */
  public boolean supports(final BackendKind kind) {
    return factories.containsKey(kind);
  }

  /**
   * Registers or replaces a backend. An unchanged configuration keeps the existing client.
   *
   * @param ref backend configuration
   * @return {@code true} if the backend is new or its connection changed
   * @throws IllegalArgumentException if no client factory exists for the backend's kind
   */
  public synchronized boolean register(final BackendRef ref) {
    final var existing = bindings.get(ref.key());
    if (existing != null && existing.ref().sameConnection(ref)) return false;

    final var factory = factories.get(ref.kind());
    if (factory == null)
      throw new IllegalArgumentException("no client available for backend kind " + ref.kind());

    final var permits =
        ref.maxConcurrency().orElse(defaultPermits);
    bindings.put(
        ref.key(), new Binding(ref, factory.create(ref), new BackendLimiter(ref.key(), permits)));
    metrics.backendHealth(ref.key(), ref.health());
    if (existing != null) closeQuietly(existing);
    LOGGER.log(
        INFO,
        "event=backend_registered backend={0} kind={1} replaced={2}",
        ref.key(),
        ref.kind(),
        existing != null);
    return true;
  }

  /**
   * Removes a backend and closes its client.
   *
   * @param key backend key
   * @return {@code true} if a backend was removed
   */
  public synchronized boolean remove(final String key) {
    final var removed = bindings.remove(key);
    if (removed == null) return false;
    closeQuietly(removed);
    metrics.forgetBackend(key);
    LOGGER.log(INFO, "event=backend_removed backend={0}", key);
    return true;
  }

  public Optional<Binding> find(final String key) {
    return Optional.ofNullable(bindings.get(key));
  }

  public Collection<String> keys() {
    return List.copyOf(bindings.keySet());
  }

  /** Probes every backend, records health and logs transitions. */
  public void checkHealth() {
    bindings.values().forEach(this::checkHealth);
  }

  BackendHealth checkHealth(final Binding binding) {
    final var ref = binding.ref();
    BackendHealth next;
    try {
      next = binding.client().healthCheck();
    } catch (final RuntimeException e) {
      next = BackendHealth.UNREACHABLE;
    }
    final var previous = ref.updateHealth(next);
    metrics.backendHealth(ref.key(), next);
    if (previous != next)
      LOGGER.log(
          next == BackendHealth.HEALTHY ? INFO : WARNING,
          "event=backend_health_transition backend={0} from={1} to={2}",
          ref.key(),
          previous,
          next);
    return next;
  }

  @Override
  public synchronized void close() {
    bindings.values().forEach(this::closeQuietly);
    bindings.clear();
  }

  private void closeQuietly(final Binding binding) {
    try {
      binding.client().close();
    } catch (final Exception e) {
      LOGGER.log(WARNING, "Failed to close client for backend " + binding.ref().key(), e);
    }
  }
}
