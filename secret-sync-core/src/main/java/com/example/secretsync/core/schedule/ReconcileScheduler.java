package com.example.secretsync.core.schedule;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsync.core.ErrorReason;
import com.example.secretsync.core.metrics.SyncMetrics;
import com.example.secretsync.core.model.SecretDescriptor;
import com.example.secretsync.core.model.SecretIdentity;
import com.example.secretsync.core.reconcile.CancellationToken;
import com.example.secretsync.core.reconcile.ReconciliationEngine;
import com.example.secretsync.core.reconcile.SyncOutcome;
import com.example.secretsync.core.registry.DescriptorRegistry;
import com.example.secretsync.core.registry.RegistryListener;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives reconciliation passes: one timer per descriptor on a single timer thread, passes on a
 * fixed worker pool fed by an explicit queue.
 *
 * <p>At most one pass per descriptor runs at a time. A trigger that arrives while a pass is in
 * flight is coalesced into it. A configuration change resets the timer and runs a pass right away,
 * or once more after the in-flight pass if there is one. Removal cancels the timer and signals the
 * in-flight pass to stop. A descriptor removed and added again gets its next pass only after the
 * old pass has returned and the registry has cleaned up after it.
 *
 * <p>After a successful pass the next one runs after the descriptor's refresh interval, never
 * sooner than the minimum refresh interval; after a failure, after the engine's backoff delay.
 */
public final class ReconcileScheduler implements RegistryListener, AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(ReconcileScheduler.class.getName());

  private final ReconciliationEngine engine;
  private final DescriptorRegistry registry;
  private final SyncMetrics metrics;
  private final Duration minRefreshInterval;
  private final Duration shutdownTimeout;
  private final ScheduledExecutorService timer;
  private final ThreadPoolExecutor workers;
  private final ConcurrentHashMap<SecretIdentity, Slot> slots = new ConcurrentHashMap<>();
  private volatile boolean started;

  /** Scheduling state of one descriptor. Mutable fields are guarded by the slot's monitor. */
  private static final class Slot {
    private final SecretIdentity identity;
    private ScheduledFuture<?> timer;
    private boolean inFlight;
    private boolean rerun;
    private boolean removed;
    private CancellationToken token = CancellationToken.none();
    private CompletableFuture<SyncOutcome> current;

    private Slot(final SecretIdentity identity) {
      this.identity = identity;
    }

    private void cancelTimer() {
      if (timer != null) timer.cancel(false);
      timer = null;
    }
  }

  private ReconcileScheduler(final Builder builder) {
    this.engine = builder.engine;
    this.registry = builder.registry;
    this.metrics = builder.metrics;
    this.minRefreshInterval = builder.minRefreshInterval;
    this.shutdownTimeout = builder.shutdownTimeout;
    this.timer =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              var t = new Thread(r, "secret-sync-timer");
              t.setDaemon(true);
              return t;
            });
    final var counter = new AtomicInteger();
    this.workers =
        new ThreadPoolExecutor(
            builder.workers,
            builder.workers,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            r -> {
              var t = new Thread(r, "secret-sync-worker-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Registers every descriptor already in the registry and runs a first pass for each. */
  public void start() {
    if (started) return;
    started = true;
    registry.list().forEach(this::register);
    slots.keySet().forEach(this::trigger);
    LOGGER.log(INFO, "Scheduler started with {0} descriptors", slots.size());
  }

  public boolean isStarted() {
    return started;
  }

  /**
   * Starts tracking a descriptor. Once the scheduler is started, a first pass runs right away.
   *
   * @param descriptor descriptor to schedule
   */
  public void register(final SecretDescriptor descriptor) {
    final var identity = descriptor.identity();
    final var created = new Slot(identity);
    final var existing = slots.putIfAbsent(identity, created);
    if (existing == null && started) trigger(identity);
  }

  /**
   * Requests a pass now. If a pass for the descriptor is already in flight the request is
   * coalesced into it.
   *
   * @param identity descriptor identity
   * @return completes with the outcome of the pass that serves this request
   */
  public CompletableFuture<SyncOutcome> trigger(final SecretIdentity identity) {
    final var slot = slots.get(identity);
    if (slot == null)
      return CompletableFuture.failedFuture(
          new IllegalArgumentException("descriptor " + identity + " is not scheduled"));
    synchronized (slot) {
      if (slot.removed)
        return CompletableFuture.failedFuture(
            new IllegalStateException("descriptor " + identity + " was removed"));
      if (slot.inFlight) {
        metrics.triggerCoalesced(identity);
        LOGGER.log(DEBUG, "Pass for {0} already in flight, coalescing trigger", identity);
        return slot.current;
      }
      return startPass(slot);
    }
  }

  /**
   * Resets the timer of a changed descriptor and forces a pass. If a pass is in flight, exactly
   * one follow-up pass runs after it.
   *
   * @param identity descriptor identity
   */
  public void reset(final SecretIdentity identity) {
    final var slot = slots.get(identity);
    if (slot == null) return;
    synchronized (slot) {
      if (slot.removed) return;
      slot.cancelTimer();
      if (slot.inFlight) slot.rerun = true;
      else if (started) startPass(slot);
    }
  }

  /**
   * Stops scheduling a descriptor and signals its in-flight pass, if any, to stop.
   *
   * @param identity descriptor identity
   * @return completes once the in-flight pass, if any, has returned
   */
  public CompletableFuture<Void> cancel(final SecretIdentity identity) {
    final var slot = slots.remove(identity);
    if (slot == null) return CompletableFuture.completedFuture(null);
    final CompletableFuture<SyncOutcome> inFlight;
    synchronized (slot) {
      slot.removed = true;
      slot.rerun = false;
      slot.cancelTimer();
      inFlight = slot.inFlight ? slot.current : null;
      if (inFlight != null) slot.token.cancel();
    }
    LOGGER.log(DEBUG, "Unscheduled {0}", identity);
    if (inFlight == null) return CompletableFuture.completedFuture(null);
    return inFlight.handle((outcome, error) -> null);
  }

  /**
   * Runs {@code check} periodically on the worker pool, e.g. backend health checks.
   *
   * @param check task to run
   * @param interval delay between the end of one run and the start of the next timer tick
   */
  public void scheduleHealthChecks(final Runnable check, final Duration interval) {
    timer.scheduleWithFixedDelay(
        () -> submit(guarded(check)), 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean isInFlight(final SecretIdentity identity) {
    final var slot = slots.get(identity);
    if (slot == null) return false;
    synchronized (slot) {
      return slot.inFlight;
    }
  }

  /** Time until the next timed pass, empty if none is scheduled. */
  public Optional<Duration> nextRunIn(final SecretIdentity identity) {
    final var slot = slots.get(identity);
    if (slot == null) return Optional.empty();
    synchronized (slot) {
      if (slot.timer == null) return Optional.empty();
      final var millis = slot.timer.getDelay(TimeUnit.MILLISECONDS);
      return Optional.of(Duration.ofMillis(Math.max(0L, millis)));
    }
  }

  /** Number of tasks waiting for a worker. */
  public int queued() {
    return workers.getQueue().size();
  }

  private CompletableFuture<SyncOutcome> startPass(final Slot slot) {
    final var future = new CompletableFuture<SyncOutcome>();
    final var token = new CancellationToken();
    slot.cancelTimer();
    slot.inFlight = true;
    slot.token = token;
    slot.current = future;
    final var removal = registry.pendingRemoval(slot.identity);
    if (removal.isDone()) dispatch(slot, token, future);
    else removal.whenComplete((ignored, error) -> dispatch(slot, token, future));
    return future;
  }

  /** Hands a pass to the workers. A re-added descriptor's pass waits for the old one's cleanup. */
  private void dispatch(
      final Slot slot,
      final CancellationToken token,
      final CompletableFuture<SyncOutcome> future) {
    try {
      workers.execute(() -> runPass(slot, token, future));
    } catch (final RejectedExecutionException e) {
      synchronized (slot) {
        slot.inFlight = false;
      }
      future.completeExceptionally(e);
    }
  }

  private void runPass(
      final Slot slot,
      final CancellationToken token,
      final CompletableFuture<SyncOutcome> future) {
    SyncOutcome outcome;
    try {
      final boolean removed;
      synchronized (slot) {
        removed = slot.removed;
      }
      outcome =
          registry
              .get(slot.identity)
              .filter(descriptor -> !removed)
              .map(descriptor -> engine.reconcile(descriptor, token))
              .orElseGet(() -> SyncOutcome.cancelled(slot.identity, Duration.ZERO, Duration.ZERO));
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Pass for " + slot.identity + " failed unexpectedly", e);
      outcome =
          SyncOutcome.failed(
              slot.identity,
              ErrorReason.INTERNAL,
              e.getMessage(),
              Duration.ZERO,
              engine.backoff().initialDelay());
    }
    afterPass(slot, outcome);
    future.complete(outcome);
  }

  private void afterPass(final Slot slot, final SyncOutcome outcome) {
    synchronized (slot) {
      slot.inFlight = false;
      if (slot.removed || !started) return;
      if (slot.rerun) {
        slot.rerun = false;
        startPass(slot);
        return;
      }
      final var delay = nextDelay(slot, outcome);
      slot.timer =
          timer.schedule(() -> trigger(slot.identity), delay.toMillis(), TimeUnit.MILLISECONDS);
      LOGGER.log(DEBUG, "Next pass for {0} in {1}ms", slot.identity, delay.toMillis());
    }
  }

  private Duration nextDelay(final Slot slot, final SyncOutcome outcome) {
    if (outcome.result() == SyncOutcome.Result.FAILED) return outcome.nextDelay();
    final var interval =
        outcome.result() == SyncOutcome.Result.SYNCED
            ? outcome.nextDelay()
            : registry
                .get(slot.identity)
                .map(SecretDescriptor::refreshInterval)
                .orElse(minRefreshInterval);
    return interval.compareTo(minRefreshInterval) < 0 ? minRefreshInterval : interval;
  }

  private void submit(final Runnable task) {
    try {
      workers.execute(task);
    } catch (final RejectedExecutionException e) {
      LOGGER.log(DEBUG, "Worker pool shut down, dropping task");
    }
  }

  private static Runnable guarded(final Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (final RuntimeException e) {
        LOGGER.log(WARNING, "Periodic task failed", e);
      }
    };
  }

  /** Cancels every timer and in-flight pass, then waits for the workers to finish. */
  @Override
  public void close() {
    started = false;
    slots.keySet().forEach(this::cancel);
    timer.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS))
        workers.shutdownNow();
    } catch (final InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    LOGGER.log(INFO, "Scheduler stopped");
  }

  @Override
  public void descriptorAdded(final SecretDescriptor descriptor) {
    register(descriptor);
  }

  @Override
  public void descriptorUpdated(final SecretDescriptor previous, final SecretDescriptor current) {
    reset(current.identity());
  }

  @Override
  public CompletionStage<Void> descriptorRemoved(final SecretDescriptor descriptor) {
    return cancel(descriptor.identity());
  }

  public static class Builder {
    private ReconciliationEngine engine;
    private DescriptorRegistry registry;
    private SyncMetrics metrics;
    private int workers = 4;
    private Duration minRefreshInterval = Duration.ofSeconds(5);
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private Builder() {}

    public Builder engine(final ReconciliationEngine engine) {
      this.engine = engine;
      return this;
    }

    public Builder registry(final DescriptorRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder metrics(final SyncMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the number of worker threads running passes.
     *
     * <p>Default: 4
     *
     * @param workers pool size
     * @return this builder
     */
    public Builder workers(final int workers) {
      this.workers = workers;
      return this;
    }

    /**
     * Sets the lower bound applied to refresh intervals after successful passes.
     *
     * <p>Default: 5 seconds
     *
     * @param minRefreshInterval minimum delay between successful passes
     * @return this builder
     */
    public Builder minRefreshInterval(final Duration minRefreshInterval) {
      this.minRefreshInterval = minRefreshInterval;
      return this;
    }

    public Builder shutdownTimeout(final Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    /**
     * Builds the scheduler. It does not run anything until {@link #start()} is called.
     *
     * @return configured scheduler
     * @throws IllegalStateException if required fields are not set
     * @throws IllegalArgumentException if a size or duration is out of range
     */
    public ReconcileScheduler build() {
      if (engine == null) throw new IllegalStateException("engine is required");
      if (registry == null) throw new IllegalStateException("registry is required");
      if (metrics == null) metrics = SyncMetrics.inMemory();
      if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
      if (minRefreshInterval == null || minRefreshInterval.isNegative())
        throw new IllegalArgumentException("minRefreshInterval must be non-negative");
      if (shutdownTimeout == null || shutdownTimeout.isNegative())
        throw new IllegalArgumentException("shutdownTimeout must be non-negative");
      return new ReconcileScheduler(this);
    }
  }
}
