package com.example.secretsync.core.reconcile;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff applied between failed passes of one descriptor.
 *
 * @param initialDelay delay after the first failure, must be > 0
 * @param maxDelay cap for the delay, must be >= initialDelay
 * @param multiplier growth factor per consecutive failure, must be >= 1.0
 * @param jitter whether to add up to 25% random jitter on top of the computed delay
 */
public record BackoffPolicy(
    Duration initialDelay, Duration maxDelay, double multiplier, boolean jitter) {

  public BackoffPolicy {
    if (initialDelay == null || initialDelay.isZero() || initialDelay.isNegative())
      throw new IllegalArgumentException("initialDelay must be > 0");
    if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0)
      throw new IllegalArgumentException("maxDelay must be >= initialDelay");
    if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
  }

  /** 5 seconds doubling up to 5 minutes, no jitter. */
  public static BackoffPolicy defaults() {
    return exponential(Duration.ofSeconds(5), Duration.ofMinutes(5));
  }

  public static BackoffPolicy exponential(final Duration initialDelay, final Duration maxDelay) {
    return new BackoffPolicy(initialDelay, maxDelay, 2.0, false);
  }

  public static BackoffPolicy fixed(final Duration delay) {
    return new BackoffPolicy(delay, delay, 1.0, false);
  }

  public BackoffPolicy withJitter() {
    return new BackoffPolicy(initialDelay, maxDelay, multiplier, true);
  }

  /**
   * Delay before the next attempt.
   *
   * @param consecutiveFailures failed passes since the last success (1 after the first failure)
   * @return the delay, never above {@code maxDelay} unless jitter is enabled
   */
  public Duration delayFor(final int consecutiveFailures) {
    final var initial = initialDelay.toMillis();
    var delay = initial;
    if (consecutiveFailures > 1 && multiplier > 1.0) {
      final var grown = initial * Math.pow(multiplier, consecutiveFailures - 1);
      delay = (long) Math.min(grown, (double) maxDelay.toMillis());
    }

    if (jitter) delay += (long) (delay * 0.25 * ThreadLocalRandom.current().nextDouble());

    return Duration.ofMillis(delay);
  }
}
