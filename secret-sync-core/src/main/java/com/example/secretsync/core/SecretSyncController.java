package com.example.secretsync.core;

import static java.lang.System.Logger.Level.INFO;

import com.example.secretsync.core.backend.BackendClientFactory;
import com.example.secretsync.core.backend.BackendRegistry;
import com.example.secretsync.core.backend.SecretsManagerBackendClient;
import com.example.secretsync.core.backend.VaultBackendClient;
import com.example.secretsync.core.manifest.Manifests;
import com.example.secretsync.core.metrics.SyncMetrics;
import com.example.secretsync.core.model.BackendHealth;
import com.example.secretsync.core.model.BackendKind;
import com.example.secretsync.core.model.BackendRef;
import com.example.secretsync.core.model.DescriptorStatus;
import com.example.secretsync.core.model.SecretDescriptor;
import com.example.secretsync.core.model.SecretIdentity;
import com.example.secretsync.core.reconcile.BackoffPolicy;
import com.example.secretsync.core.reconcile.ReconciliationEngine;
import com.example.secretsync.core.reconcile.SyncOutcome;
import com.example.secretsync.core.registry.DescriptorRegistry;
import com.example.secretsync.core.schedule.ReconcileScheduler;
import com.example.secretsync.core.store.InMemorySecretStore;
import com.example.secretsync.core.store.SecretStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point wiring backends, descriptor registry, reconciliation engine and scheduler.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var controller = SecretSyncController.builder()
 *     .store(store)
 *     .workers(8)
 *     .build();
 *
 * controller.apply(new ManifestLoader().load(Path.of("manifests.yaml")));
 * controller.start();
 * }</pre>
 *
 * <h2>Forcing a Pass</h2>
 *
 * <pre>{@code
 * var outcome = controller.reconcileNow(SecretIdentity.of("payments", "db-credentials")).join();
 * }</pre>
 */
public final class SecretSyncController implements AutoCloseable {

  private static final System.Logger LOGGER =
      System.getLogger(SecretSyncController.class.getName());

  private final SecretStore store;
  private final SyncMetrics metrics;
  private final BackendRegistry backends;
  private final DescriptorRegistry registry;
  private final ReconciliationEngine engine;
  private final ReconcileScheduler scheduler;
  private final Duration healthCheckInterval;

  /**
   * What {@link #apply(Manifests)} changed.
   *
   * @param backendsAdded keys of newly registered backends
   * @param backendsUpdated keys of backends whose connection changed
   * @param backendsRemoved keys of removed backends
   * @param descriptorsAdded newly registered descriptors
   * @param descriptorsUpdated descriptors whose desired state changed
   * @param descriptorsRemoved removed descriptors
   */
  public record ApplySummary(
      List<String> backendsAdded,
      List<String> backendsUpdated,
      List<String> backendsRemoved,
      List<SecretIdentity> descriptorsAdded,
      List<SecretIdentity> descriptorsUpdated,
      List<SecretIdentity> descriptorsRemoved) {

    public boolean isEmpty() {
      return backendsAdded.isEmpty()
          && backendsUpdated.isEmpty()
          && backendsRemoved.isEmpty()
          && descriptorsAdded.isEmpty()
          && descriptorsUpdated.isEmpty()
          && descriptorsRemoved.isEmpty();
    }
  }

  private SecretSyncController(final Builder builder) {
    this.store = builder.store;
    this.metrics = builder.metrics;
    this.healthCheckInterval = builder.healthCheckInterval;

    final var factories = new EnumMap<BackendKind, BackendClientFactory>(BackendKind.class);
    factories.put(BackendKind.VAULT_LIKE, VaultBackendClient.factory(builder.callTimeout));
    factories.put(
        BackendKind.CLOUD_SECRETS_MANAGER,
        SecretsManagerBackendClient.factory(builder.callTimeout));
    factories.putAll(builder.factories);

    this.backends = new BackendRegistry(factories, builder.backendPermits, metrics);
    this.registry = new DescriptorRegistry(store);
    this.engine =
        ReconciliationEngine.builder()
            .backends(backends)
            .store(store)
            .metrics(metrics)
            .callTimeout(builder.callTimeout)
            .passTimeout(builder.passTimeout)
            .fetchConcurrency(builder.fetchConcurrency)
            .backoff(builder.backoff)
            .clock(builder.clock)
            .build();
    this.scheduler =
        ReconcileScheduler.builder()
            .engine(engine)
            .registry(registry)
            .metrics(metrics)
            .workers(builder.workers)
            .minRefreshInterval(builder.minRefreshInterval)
            .build();
    registry.addListener(scheduler);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Brings the configured backends and descriptors in line with {@code manifests}. Descriptors
   * whose backend was added, changed or removed get an immediate pass even when the descriptor
   * itself did not change.
   *
   * @param manifests complete desired configuration
   * @return what changed
   * @throws IllegalArgumentException if a backend has a kind no client is available for; nothing
   *     is applied then
   */
  public synchronized ApplySummary apply(final Manifests manifests) {
    for (final BackendRef ref : manifests.backends())
      if (!backends.supports(ref.kind()))
        throw new IllegalArgumentException(
            "no client available for kind " + ref.kind() + " of backend " + ref.key());

    final var backendsAdded = new ArrayList<String>();
    final var backendsUpdated = new ArrayList<String>();
    final var backendsRemoved = new ArrayList<String>();
    final var desiredBackends = new HashSet<String>();

    for (final var ref : manifests.backends()) {
      desiredBackends.add(ref.key());
      final var known = backends.find(ref.key()).isPresent();
      if (backends.register(ref)) (known ? backendsUpdated : backendsAdded).add(ref.key());
    }
    for (final var key : backends.keys())
      if (!desiredBackends.contains(key) && backends.remove(key)) backendsRemoved.add(key);

    final var descriptorsAdded = new ArrayList<SecretIdentity>();
    final var descriptorsUpdated = new ArrayList<SecretIdentity>();
    final var descriptorsRemoved = new ArrayList<SecretIdentity>();
    final var desired = new HashSet<SecretIdentity>();
    final var changedBackends = new HashSet<String>(backendsUpdated);
    changedBackends.addAll(backendsAdded);
    changedBackends.addAll(backendsRemoved);

    for (final var descriptor : manifests.descriptors()) {
      desired.add(descriptor.identity());
      switch (registry.upsert(descriptor)) {
        case ADDED -> descriptorsAdded.add(descriptor.identity());
        case UPDATED -> descriptorsUpdated.add(descriptor.identity());
        case UNCHANGED -> {
          if (changedBackends.contains(descriptor.backendKey()))
            scheduler.reset(descriptor.identity());
        }
      }
    }
    for (final var descriptor : registry.list()) {
      final var identity = descriptor.identity();
      if (!desired.contains(identity) && registry.remove(identity).isPresent()) {
        metrics.forgetDescriptor(identity);
        descriptorsRemoved.add(identity);
      }
    }

    final var summary =
        new ApplySummary(
            List.copyOf(backendsAdded),
            List.copyOf(backendsUpdated),
            List.copyOf(backendsRemoved),
            List.copyOf(descriptorsAdded),
            List.copyOf(descriptorsUpdated),
            List.copyOf(descriptorsRemoved));
    LOGGER.log(
        INFO,
        "event=manifests_applied backends={0} descriptors={1} added={2} updated={3} removed={4}",
        manifests.backends().size(),
        manifests.descriptors().size(),
        descriptorsAdded.size(),
        descriptorsUpdated.size(),
        descriptorsRemoved.size());
    return summary;
  }

  /** Starts periodic passes and backend health checks. */
  public void start() {
    scheduler.start();
    scheduler.scheduleHealthChecks(backends::checkHealth, healthCheckInterval);
  }

  /**
   * Runs a pass for one descriptor now, or joins the one in flight.
   *
   * @param identity descriptor identity
   * @return completes with the outcome of the pass
   */
  public CompletableFuture<SyncOutcome> reconcileNow(final SecretIdentity identity) {
    return scheduler.trigger(identity);
  }

  public Optional<DescriptorStatus> status(final SecretIdentity identity) {
    return registry.get(identity).map(SecretDescriptor::status);
  }

  /** Status of every descriptor, sorted by identity. */
  public Map<SecretIdentity, DescriptorStatus> statuses() {
    final var statuses = new LinkedHashMap<SecretIdentity, DescriptorStatus>();
    registry.list().forEach(d -> statuses.put(d.identity(), d.status()));
    return statuses;
  }

  /** Health of every backend, sorted by key. */
  public Map<String, BackendHealth> backendHealth() {
    final var health = new TreeMap<String, BackendHealth>();
    for (final var key : backends.keys())
      backends.find(key).ifPresent(binding -> health.put(key, binding.ref().health()));
    return health;
  }

  public DescriptorRegistry registry() {
    return registry;
  }

  public SyncMetrics metrics() {
    return metrics;
  }

  public SecretStore store() {
    return store;
  }

  /** Stops the scheduler, then closes every backend client. */
  public void shutdown() {
    scheduler.close();
    backends.close();
    LOGGER.log(INFO, "Controller stopped");
  }

  @Override
  public void close() {
    shutdown();
  }

  /**
   * Builder for {@link SecretSyncController}. Every setting has a default; the store defaults to an
   * in-memory one.
   */
  public static class Builder {
    private SecretStore store;
    private SyncMetrics metrics;
    private final Map<BackendKind, BackendClientFactory> factories = new HashMap<>();
    private int backendPermits = 8;
    private int workers = 4;
    private int fetchConcurrency = 4;
    private Duration callTimeout = Duration.ofSeconds(10);
    private Duration passTimeout = Duration.ofSeconds(60);
    private Duration minRefreshInterval = Duration.ofSeconds(5);
    private Duration healthCheckInterval = Duration.ofSeconds(30);
    private BackoffPolicy backoff = BackoffPolicy.defaults();
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    public Builder store(final SecretStore store) {
      this.store = store;
      return this;
    }

    public Builder metrics(final SyncMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Replaces the client factory used for one backend kind.
     *
     * @param kind backend kind
     * @param factory client factory
     * @return this builder
     */
    public Builder clientFactory(final BackendKind kind, final BackendClientFactory factory) {
      this.factories.put(kind, factory);
      return this;
    }

    /**
     * Sets the default number of concurrent calls per backend; a backend can override it with its
     * {@value BackendRef#MAX_CONCURRENCY} parameter.
     *
     * <p>Default: 8
     *
     * @param backendPermits concurrent calls per backend
     * @return this builder
     */
    public Builder backendPermits(final int backendPermits) {
      this.backendPermits = backendPermits;
      return this;
    }

    public Builder workers(final int workers) {
      this.workers = workers;
      return this;
    }

    public Builder fetchConcurrency(final int fetchConcurrency) {
      this.fetchConcurrency = fetchConcurrency;
      return this;
    }

    public Builder callTimeout(final Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    public Builder passTimeout(final Duration passTimeout) {
      this.passTimeout = passTimeout;
      return this;
    }

    public Builder minRefreshInterval(final Duration minRefreshInterval) {
      this.minRefreshInterval = minRefreshInterval;
      return this;
    }

    public Builder healthCheckInterval(final Duration healthCheckInterval) {
      this.healthCheckInterval = healthCheckInterval;
      return this;
    }

    public Builder backoff(final BackoffPolicy backoff) {
      this.backoff = backoff;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the controller. Nothing runs until {@link SecretSyncController#start()}.
     *
     * @return configured controller
     * @throws IllegalStateException if a setting is missing
     * @throws IllegalArgumentException if a setting is out of range
     */
    public SecretSyncController build() {
      if (store == null) store = new InMemorySecretStore();
      if (metrics == null) metrics = SyncMetrics.inMemory();
      if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative())
        throw new IllegalArgumentException("callTimeout must be > 0");
      if (healthCheckInterval == null
          || healthCheckInterval.isZero()
          || healthCheckInterval.isNegative())
        throw new IllegalArgumentException("healthCheckInterval must be > 0");
      if (backendPermits < 1) throw new IllegalArgumentException("backendPermits must be >= 1");
      return new SecretSyncController(this);
    }
  }
}
