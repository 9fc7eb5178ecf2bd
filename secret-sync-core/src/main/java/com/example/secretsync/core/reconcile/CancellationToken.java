package com.example.secretsync.core.reconcile;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation signal for one reconciliation pass. */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** Token that is never cancelled. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
