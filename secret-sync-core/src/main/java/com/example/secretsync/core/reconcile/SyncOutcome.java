package com.example.secretsync.core.reconcile;

import com.example.secretsync.core.ErrorReason;
import com.example.secretsync.core.model.SecretIdentity;
import java.time.Duration;
import java.util.Optional;

/**
 * Result of one reconciliation pass.
 *
 * @param identity descriptor identity
 * @param result how the pass ended
 * @param action write performed against the store
 * @param reason failure reason, {@code null} unless {@code result} is FAILED
 * @param message failure message, {@code null} unless {@code result} is FAILED
 * @param contentHash content hash of the destination object after the pass, if synced
 * @param duration wall time of the pass
 * @param nextDelay delay until the next pass should start
 */
public record SyncOutcome(
    SecretIdentity identity,
    Result result,
    WriteAction action,
    ErrorReason reason,
    String message,
    String contentHash,
    Duration duration,
    Duration nextDelay) {

  public enum Result {
    SYNCED,
    FAILED,
    CANCELLED
  }

  public enum WriteAction {
    NONE,
    CREATED,
    UPDATED
  }

  public static SyncOutcome synced(
      final SecretIdentity identity,
      final WriteAction action,
      final String contentHash,
      final Duration duration,
      final Duration nextDelay) {
    return new SyncOutcome(
        identity, Result.SYNCED, action, null, null, contentHash, duration, nextDelay);
  }

  public static SyncOutcome failed(
      final SecretIdentity identity,
      final ErrorReason reason,
      final String message,
      final Duration duration,
      final Duration nextDelay) {
    return new SyncOutcome(
        identity, Result.FAILED, WriteAction.NONE, reason, message, null, duration, nextDelay);
  }

  public static SyncOutcome cancelled(
      final SecretIdentity identity, final Duration duration, final Duration nextDelay) {
    return new SyncOutcome(
        identity,
        Result.CANCELLED,
        WriteAction.NONE,
        ErrorReason.CANCELLED,
        null,
        null,
        duration,
        nextDelay);
  }

  public boolean succeeded() {
    return result == Result.SYNCED;
  }

  public boolean wrote() {
    return action != WriteAction.NONE;
  }

  public Optional<ErrorReason> failureReason() {
    return result == Result.FAILED ? Optional.of(reason) : Optional.empty();
  }
}
