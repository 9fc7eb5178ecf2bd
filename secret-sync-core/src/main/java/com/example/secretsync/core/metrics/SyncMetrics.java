package com.example.secretsync.core.metrics;

import com.example.secretsync.core.ErrorReason;
import com.example.secretsync.core.model.BackendHealth;
import com.example.secretsync.core.model.SecretIdentity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer instrumentation of the controller.
 *
 * <ul>
 *   <li>{@value #SYNC_SUCCESS} counter per descriptor
 *   <li>{@value #SYNC_FAILURE} counter per descriptor and reason
 *   <li>{@value #SYNC_LAST_DURATION} gauge per descriptor, milliseconds
 *   <li>{@value #SCHEDULER_COALESCED} counter per descriptor
 *   <li>{@value #BACKEND_HEALTH} gauge per backend: 1 healthy, 0 unreachable, -1 unknown
 * </ul>
 */
public final class SyncMetrics {

  public static final String SYNC_SUCCESS = "secretsync.sync.success";
  public static final String SYNC_FAILURE = "secretsync.sync.failure";
  public static final String SYNC_LAST_DURATION = "secretsync.sync.last.duration";
  public static final String SCHEDULER_COALESCED = "secretsync.scheduler.coalesced";
  public static final String BACKEND_HEALTH = "secretsync.backend.health";

  private static final String DESCRIPTOR_TAG = "descriptor";
  private static final String BACKEND_TAG = "backend";

  private final MeterRegistry registry;
  private final ConcurrentHashMap<SecretIdentity, AtomicLong> lastDurations =
      new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, AtomicInteger> backendHealth = new ConcurrentHashMap<>();

  public SyncMetrics(final MeterRegistry registry) {
    this.registry = registry;
  }

  /** Metrics kept in memory only, for embedding without an exporter. */
  public static SyncMetrics inMemory() {
    return new SyncMetrics(new SimpleMeterRegistry());
  }

  public MeterRegistry registry() {
    return registry;
  }

  public void syncSucceeded(final SecretIdentity identity, final Duration duration) {
    Counter.builder(SYNC_SUCCESS)
        .description("Successful reconciliation passes")
        .tag(DESCRIPTOR_TAG, identity.toString())
        .register(registry)
        .increment();
    lastDuration(identity).set(duration.toMillis());
  }

  public void syncFailed(
      final SecretIdentity identity, final ErrorReason reason, final Duration duration) {
    Counter.builder(SYNC_FAILURE)
        .description("Failed reconciliation passes")
        .tags(Tags.of(DESCRIPTOR_TAG, identity.toString(), "reason", reason.name()))
        .register(registry)
        .increment();
    lastDuration(identity).set(duration.toMillis());
  }

  public void triggerCoalesced(final SecretIdentity identity) {
    registry.counter(SCHEDULER_COALESCED, DESCRIPTOR_TAG, identity.toString()).increment();
  }

  public void backendHealth(final String backendKey, final BackendHealth health) {
    backendHealth
        .computeIfAbsent(
            backendKey,
            key ->
                registry.gauge(BACKEND_HEALTH, Tags.of(BACKEND_TAG, key), new AtomicInteger(-1)))
        .set(
            switch (health) {
              case HEALTHY -> 1;
              case UNREACHABLE -> 0;
              case UNKNOWN -> -1;
            });
  }

  /** Drops every meter of a removed descriptor. */
  public void forgetDescriptor(final SecretIdentity identity) {
    lastDurations.remove(identity);
    final var tag = identity.toString();
    for (final var name :
        List.of(SYNC_SUCCESS, SYNC_FAILURE, SYNC_LAST_DURATION, SCHEDULER_COALESCED))
      registry.find(name).tag(DESCRIPTOR_TAG, tag).meters().forEach(registry::remove);
  }

  public void forgetBackend(final String backendKey) {
    backendHealth.remove(backendKey);
    registry.find(BACKEND_HEALTH).tag(BACKEND_TAG, backendKey).meters().forEach(registry::remove);
  }

  private AtomicLong lastDuration(final SecretIdentity identity) {
    return lastDurations.computeIfAbsent(
        identity,
        id ->
            registry.gauge(
                SYNC_LAST_DURATION, Tags.of(DESCRIPTOR_TAG, id.toString()), new AtomicLong()));
  }
}
