package com.example.secretsync.core.reconcile;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsync.core.ErrorReason;
import com.example.secretsync.core.SyncException;
import com.example.secretsync.core.backend.BackendRegistry;
import com.example.secretsync.core.backend.BackendRegistry.Binding;
import com.example.secretsync.core.backend.JsonValues;
import com.example.secretsync.core.backend.ResolvedSecretValue;
import com.example.secretsync.core.metrics.SyncMetrics;
import com.example.secretsync.core.model.BulkSource;
import com.example.secretsync.core.model.CreationPolicy;
import com.example.secretsync.core.model.DescriptorStatus;
import com.example.secretsync.core.model.SecretDescriptor;
import com.example.secretsync.core.model.SecretTemplate;
import com.example.secretsync.core.model.SyncPhase;
import com.example.secretsync.core.model.SyncStatus;
import com.example.secretsync.core.reconcile.SyncOutcome.WriteAction;
import com.example.secretsync.core.store.RenderedPayload;
import com.example.secretsync.core.store.SecretStore;
import com.example.secretsync.core.store.StoreObjectHandle;
import com.example.secretsync.core.template.TemplateRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs reconciliation passes: fetch from the bound backend, render, diff against the store and
 * apply.
 *
 * <p>A pass never throws. Every failure is classified, recorded on the descriptor's status and
 * returned in the {@link SyncOutcome}. All secret buffers created by a pass are zeroed before
 * {@link #reconcile} returns.
 *
 * <pre>{@code
 * var engine = ReconciliationEngine.builder()
 *     .backends(backendRegistry)
 *     .store(store)
 *     .callTimeout(Duration.ofSeconds(5))
 *     .passTimeout(Duration.ofSeconds(30))
 *     .build();
 *
 * var outcome = engine.reconcile(descriptor, CancellationToken.none());
 * }</pre>
 */
public final class ReconciliationEngine {

  private static final System.Logger LOGGER =
      System.getLogger(ReconciliationEngine.class.getName());

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final BackendRegistry backends;
  private final SecretStore store;
  private final SyncMetrics metrics;
  private final Duration callTimeout;
  private final Duration passTimeout;
  private final int fetchConcurrency;
  private final BackoffPolicy backoff;
  private final Clock clock;

  /** One remote read planned for a pass. {@code field} is null for an EXTRACT expansion. */
  private record Planned(String field, String remoteKey, String property) {}

  private record Applied(WriteAction action, String contentHash) {}

  private ReconciliationEngine(final Builder builder) {
    this.backends = builder.backends;
    this.store = builder.store;
    this.metrics = builder.metrics;
    this.callTimeout = builder.callTimeout;
    this.passTimeout = builder.passTimeout;
    this.fetchConcurrency = builder.fetchConcurrency;
    this.backoff = builder.backoff;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  public BackoffPolicy backoff() {
    return backoff;
  }

  public SyncOutcome reconcile(final SecretDescriptor descriptor) {
    return reconcile(descriptor, CancellationToken.none());
  }

  /**
   * Runs one pass for {@code descriptor}.
   *
   * @param descriptor descriptor to reconcile
   * @param token checked between phases and before every remote read
   * @return the outcome, with the delay until the next pass
   */
  public SyncOutcome reconcile(final SecretDescriptor descriptor, final CancellationToken token) {
    final var identity = descriptor.identity();
    final var started = clock.instant();
    final var deadline = System.nanoTime() + passTimeout.toNanos();

    try (var resources = new PassResources()) {
      checkpoint(descriptor, token, deadline);
      descriptor.updateStatus(DescriptorStatus::retrying);
      enter(descriptor, SyncPhase.FETCHING, token, deadline);
      final var binding =
          backends
              .find(descriptor.backendKey())
              .orElseThrow(
                  () ->
                      new SyncException(
                          ErrorReason.BACKEND_NOT_FOUND,
                          "backend " + descriptor.backendKey() + " is not configured"));
      final var values = fetch(descriptor, binding, resources, token, deadline);

      enter(descriptor, SyncPhase.RENDERING, token, deadline);
      final var template = descriptor.template();
      final var type = template.map(SecretTemplate::type).orElse(SecretTemplate.DEFAULT_TYPE);
      final Map<String, byte[]> data;
      if (template.isPresent()) {
        data = TemplateRenderer.render(template.get(), values);
        data.values().forEach(resources::track);
      } else {
        data = values;
      }

      enter(descriptor, SyncPhase.DIFFING, token, deadline);
      final var applied = apply(descriptor, type, data, resources, token, deadline);

      final var duration = Duration.between(started, clock.instant());
      descriptor.updateStatus(s -> s.synced(clock.instant(), applied.contentHash()));
      metrics.syncSucceeded(identity, duration);
      LOGGER.log(
          INFO,
          "event=sync_succeeded descriptor={0} action={1} durationMs={2}",
          identity,
          applied.action(),
          duration.toMillis());
      return SyncOutcome.synced(
          identity,
          applied.action(),
          applied.contentHash(),
          duration,
          descriptor.refreshInterval());
    } catch (final RuntimeException e) {
      return failed(descriptor, SyncException.from(e), started);
    }
  }

  private SyncOutcome failed(
      final SecretDescriptor descriptor, final SyncException error, final Instant started) {
    final var identity = descriptor.identity();
    final var duration = Duration.between(started, clock.instant());

    if (error.reason() == ErrorReason.CANCELLED) {
      descriptor.updateStatus(s -> s.withPhase(settledPhase(s.status())));
      LOGGER.log(DEBUG, "event=sync_cancelled descriptor={0}", identity);
      return SyncOutcome.cancelled(identity, duration, descriptor.refreshInterval());
    }

    final var phase = descriptor.status().phase();
    final var status = descriptor.updateStatus(s -> s.failed(error.reason(), error.getMessage()));
    metrics.syncFailed(identity, error.reason(), duration);

    final String event;
    if (error.reason() == ErrorReason.OWNERSHIP_CONFLICT) event = "ownership_conflict";
    else if (phase == SyncPhase.FETCHING) event = "fetch_failed";
    else if (phase == SyncPhase.RENDERING) event = "render_failed";
    else event = "sync_failed";

    final var nextDelay = backoff.delayFor(status.consecutiveFailures());
    LOGGER.log(
        WARNING,
        "event={0} descriptor={1} reason={2} failures={3} retryInMs={4} message={5}",
        event,
        identity,
        error.reason(),
        status.consecutiveFailures(),
        nextDelay.toMillis(),
        error.getMessage());
    return SyncOutcome.failed(identity, error.reason(), error.getMessage(), duration, nextDelay);
  }

  private static SyncPhase settledPhase(final SyncStatus status) {
    return switch (status) {
      case SYNCED -> SyncPhase.SYNCED;
      case ERROR -> SyncPhase.ERROR;
      case PENDING -> SyncPhase.PENDING;
    };
  }

  private void enter(
      final SecretDescriptor descriptor,
      final SyncPhase phase,
      final CancellationToken token,
      final long deadline) {
    checkpoint(descriptor, token, deadline);
    descriptor.updateStatus(s -> s.withPhase(phase));
  }

  private void checkpoint(
      final SecretDescriptor descriptor, final CancellationToken token, final long deadline) {
    if (token.isCancelled())
      throw SyncException.cancelled("pass for " + descriptor.identity() + " cancelled");
    if (System.nanoTime() - deadline > 0)
      throw SyncException.timeout(
          "pass for " + descriptor.identity() + " exceeded " + passTimeout.toMillis() + "ms");
  }

  private Duration remaining(final long deadline) {
    return Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
  }

  private Duration callWait(final long deadline) {
    final var left = remaining(deadline);
    return left.compareTo(callTimeout) < 0 ? left : callTimeout;
  }

  /**
   * Resolves every field of the descriptor. Bulk sources come first in declaration order, then
   * explicit mappings, which win on a key collision. A template-only descriptor reads each
   * placeholder from the remote key of the same name.
   */
  private Map<String, byte[]> fetch(
      final SecretDescriptor descriptor,
      final Binding binding,
      final PassResources resources,
      final CancellationToken token,
      final long deadline) {
    final var plan = new ArrayList<Planned>();
    for (final var source : descriptor.bulkSources()) {
      if (source.mode() == BulkSource.Mode.EXTRACT) {
        plan.add(new Planned(null, source.key(), null));
      } else {
        checkpoint(descriptor, token, deadline);
        for (final var key : binding.listKeys(source.key(), callWait(deadline)))
          plan.add(new Planned(findFieldName(source.key(), key), key, null));
      }
    }
    descriptor
        .mappings()
        .forEach(m -> plan.add(new Planned(m.secretKey(), m.remoteKey(), m.property())));
    if (plan.isEmpty() && descriptor.bulkSources().isEmpty())
      descriptor
          .template()
          .map(TemplateRenderer::referencedFields)
          .ifPresent(fields -> fields.forEach(f -> plan.add(new Planned(f, f, null))));

    final var fetched = fetchAll(descriptor, binding, plan, resources, token, deadline);

    final var values = new LinkedHashMap<String, byte[]>();
    for (var i = 0; i < plan.size(); i++) {
      final var planned = plan.get(i);
      final var value = fetched.get(i);
      if (planned.field() == null) {
        expand(value, resources).forEach(values::put);
      } else {
        values.put(planned.field(), resources.track(value.bytes()));
      }
    }
    return values;
  }

  private List<ResolvedSecretValue> fetchAll(
      final SecretDescriptor descriptor,
      final Binding binding,
      final List<Planned> plan,
      final PassResources resources,
      final CancellationToken token,
      final long deadline) {
    if (plan.isEmpty()) return List.of();

    checkpoint(descriptor, token, deadline);
    try {
      return Flux.fromIterable(plan)
          .flatMapSequential(
              planned ->
                  Mono.fromCallable(
                          () -> {
                            checkpoint(descriptor, token, deadline);
                            return resources.track(
                                binding.fetch(
                                    planned.remoteKey(), planned.property(), callWait(deadline)));
                          })
                      .subscribeOn(Schedulers.boundedElastic()),
              fetchConcurrency)
          .collectList()
          .timeout(
              remaining(deadline),
              Mono.error(
                  () ->
                      SyncException.timeout(
                          "fetches for "
                              + descriptor.identity()
                              + " exceeded "
                              + passTimeout.toMillis()
                              + "ms")))
          .block();
    } catch (final RuntimeException e) {
      if (Exceptions.unwrap(e) instanceof InterruptedException) {
        Thread.currentThread().interrupt();
        throw SyncException.cancelled("interrupted fetching for " + descriptor.identity());
      }
      throw e;
    }
  }

  /** Splits a JSON object value into one field per top-level property. */
  private static Map<String, byte[]> expand(
      final ResolvedSecretValue value, final PassResources resources) {
    final var buffer = resources.track(value.bytes());
    final JsonNode root;
    try {
      root = MAPPER.readTree(buffer);
    } catch (final IOException e) {
      throw SyncException.notFound("remote key " + value.remoteKey() + " is not a JSON object");
    }
    if (root == null || !root.isObject())
      throw SyncException.notFound("remote key " + value.remoteKey() + " is not a JSON object");

    final var fields = new LinkedHashMap<String, byte[]>();
    root.fields()
        .forEachRemaining(
            entry ->
                fields.put(entry.getKey(), resources.track(JsonValues.toBytes(entry.getValue()))));
    return fields;
  }

  static String findFieldName(final String prefix, final String key) {
    final var normalized = trimSlashes(prefix == null ? "" : prefix);
    var relative = key.startsWith(normalized) ? key.substring(normalized.length()) : key;
    relative = trimSlashes(relative);
    return (relative.isEmpty() ? trimSlashes(key) : relative).replace('/', '_');
  }

  private static String trimSlashes(final String value) {
    var start = 0;
    var end = value.length();
    while (start < end && value.charAt(start) == '/') start++;
    while (end > start && value.charAt(end - 1) == '/') end--;
    return value.substring(start, end);
  }

  /** Writes the payload, re-reading and retrying once when the store reports a conflict. */
  private Applied apply(
      final SecretDescriptor descriptor,
      final String type,
      final Map<String, byte[]> data,
      final PassResources resources,
      final CancellationToken token,
      final long deadline) {
    try {
      return applyOnce(descriptor, type, data, resources, token, deadline);
    } catch (final SyncException e) {
      if (e.reason() != ErrorReason.CONFLICT) throw e;
      LOGGER.log(
          DEBUG,
          "Write conflict for {0}, re-reading and retrying: {1}",
          descriptor.identity(),
          e.getMessage());
      return applyOnce(descriptor, type, data, resources, token, deadline);
    }
  }

  private Applied applyOnce(
      final SecretDescriptor descriptor,
      final String type,
      final Map<String, byte[]> data,
      final PassResources resources,
      final CancellationToken token,
      final long deadline) {
    final var identity = descriptor.identity();
    final var owner = identity.toString();
    final var policy = descriptor.creationPolicy();
    final var existing = store.get(identity);

    if (existing.isEmpty()) {
      if (policy == CreationPolicy.NONE)
        throw new SyncException(
            ErrorReason.NOT_FOUND_AND_CREATION_FORBIDDEN,
            "object " + identity + " does not exist and creation policy is NONE");
      final var payload = resources.track(RenderedPayload.of(type, data, owner));
      enter(descriptor, SyncPhase.APPLYING, token, deadline);
      return new Applied(WriteAction.CREATED, store.create(identity, payload).contentHash());
    }

    final var handle = existing.get();
    if (policy != CreationPolicy.MERGE && !handle.isOwnedBy(owner))
      throw new SyncException(
          ErrorReason.OWNERSHIP_CONFLICT,
          "object "
              + identity
              + " is owned by "
              + handle.owner().orElse("nobody")
              + ", not by this descriptor");

    final var payload =
        resources.track(
            policy == CreationPolicy.MERGE
                ? merged(handle, data)
                : RenderedPayload.of(type, data, owner));
    if (unchanged(handle, payload)) return new Applied(WriteAction.NONE, handle.contentHash());

    enter(descriptor, SyncPhase.APPLYING, token, deadline);
    final var updated = store.update(identity, payload, handle.resourceVersion());
    return new Applied(WriteAction.UPDATED, updated.contentHash());
  }

  /** Existing fields overlaid with the descriptor's fields; type and owner stay as they are. */
  private static RenderedPayload merged(
      final StoreObjectHandle handle, final Map<String, byte[]> data) {
    final var fields = new TreeMap<String, byte[]>();
    handle.data().forEach((key, value) -> fields.put(key, value.clone()));
    data.forEach((key, value) -> fields.put(key, value.clone()));
    return RenderedPayload.of(handle.type(), fields, handle.ownerMarker());
  }

  private static boolean unchanged(final StoreObjectHandle handle, final RenderedPayload payload) {
    return payload.contentHash().equals(handle.contentHash())
        && payload.type().equals(handle.type())
        && Objects.equals(payload.ownerMarker(), handle.ownerMarker());
  }

  public static class Builder {
    private BackendRegistry backends;
    private SecretStore store;
    private SyncMetrics metrics;
    private Duration callTimeout = Duration.ofSeconds(10);
    private Duration passTimeout = Duration.ofSeconds(60);
    private int fetchConcurrency = 4;
    private BackoffPolicy backoff = BackoffPolicy.defaults();
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the registry of bound backends (required).
     *
     * @param backends backend registry
     * @return this builder
     */
    public Builder backends(final BackendRegistry backends) {
      this.backends = backends;
      return this;
    }

    /**
     * Sets the destination store (required).
     *
     * @param store destination store
     * @return this builder
     */
    public Builder store(final SecretStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the metrics sink.
     *
     * <p>Default: in-memory registry
     *
     * @param metrics metrics sink
     * @return this builder
     */
    public Builder metrics(final SyncMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the longest wait for a backend permit per remote call.
     *
     * <p>Default: 10 seconds
     *
     * @param callTimeout per-call timeout
     * @return this builder
     */
    public Builder callTimeout(final Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    /**
     * Sets the deadline for a whole pass; exceeding it fails the pass with TIMEOUT.
     *
     * <p>Default: 60 seconds
     *
     * @param passTimeout whole-pass deadline
     * @return this builder
     */
    public Builder passTimeout(final Duration passTimeout) {
      this.passTimeout = passTimeout;
      return this;
    }

    /**
     * Sets how many remote reads of one pass may run at once.
     *
     * <p>Default: 4
     *
     * @param fetchConcurrency maximum parallel reads within a pass
     * @return this builder
     */
    public Builder fetchConcurrency(final int fetchConcurrency) {
      this.fetchConcurrency = fetchConcurrency;
      return this;
    }

    /**
     * Sets the backoff applied after failed passes.
     *
     * <p>Default: {@link BackoffPolicy#defaults()}
     *
     * @param backoff backoff policy
     * @return this builder
     */
    public Builder backoff(final BackoffPolicy backoff) {
      this.backoff = backoff;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the engine.
     *
     * @return configured engine
     * @throws IllegalStateException if required fields are not set
     * @throws IllegalArgumentException if a timeout or the concurrency is not positive
     */
    public ReconciliationEngine build() {
      if (backends == null) throw new IllegalStateException("backends is required");
      if (store == null) throw new IllegalStateException("store is required");
      if (metrics == null) metrics = SyncMetrics.inMemory();
      if (backoff == null) throw new IllegalStateException("backoff cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative())
        throw new IllegalArgumentException("callTimeout must be > 0");
      if (passTimeout == null || passTimeout.isZero() || passTimeout.isNegative())
        throw new IllegalArgumentException("passTimeout must be > 0");
      if (fetchConcurrency < 1) throw new IllegalArgumentException("fetchConcurrency must be >= 1");
      return new ReconciliationEngine(this);
    }
  }
}
