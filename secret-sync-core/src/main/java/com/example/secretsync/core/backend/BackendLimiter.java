package com.example.secretsync.core.backend;

import com.example.secretsync.core.SyncException;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Caps concurrent calls against one backend across every descriptor that uses it.
 *
 * <p>Permits are fair so a busy descriptor cannot starve the others.
 */
public final class BackendLimiter {

  private final String backendKey;
  private final int permits;
  private final Semaphore semaphore;

  public BackendLimiter(final String backendKey, final int permits) {
    if (permits < 1) throw new IllegalArgumentException("permits must be >= 1");
    this.backendKey = backendKey;
    this.permits = permits;
    this.semaphore = new Semaphore(permits, true);
  }

  /**
   * Runs {@code call} while holding a permit.
   *
   * @param wait how long to wait for a permit
   * @param call the backend call
   * @param <T> result type
   * @return the call's result
   * @throws SyncException with reason TIMEOUT if no permit frees up in time, CANCELLED if
   *     interrupted while waiting
   */
  public <T> T call(final Duration wait, final Supplier<T> call) {
    final boolean acquired;
    try {
      acquired = semaphore.tryAcquire(wait.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw SyncException.cancelled("interrupted waiting for backend " + backendKey);
    }
    if (!acquired)
      throw SyncException.timeout(
          "no free slot for backend " + backendKey + " within " + wait.toMillis() + "ms");
    try {
      return call.get();
    } finally {
      semaphore.release();
    }
  }

  public int permits() {
    return permits;
  }

  public int inUse() {
    return permits - semaphore.availablePermits();
  }
}
