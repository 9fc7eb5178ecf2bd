package com.example.secretsync.core.model;

import com.example.secretsync.core.ErrorReason;
import java.time.Instant;

/**
 * Immutable snapshot of a descriptor's observed state.
 *
 * @param status last-sync status
 * @param phase current or last step of the reconciliation pass
 * @param lastSyncTime time of the last successful pass, {@code null} before the first one
 * @param errorReason reason of the last failure, {@code null} when the last pass succeeded
 * @param errorMessage message of the last failure, {@code null} when the last pass succeeded
 * @param contentHash content hash of the last payload written or confirmed
 * @param consecutiveFailures failed passes since the last success
 */
public record DescriptorStatus(
    SyncStatus status,
    SyncPhase phase,
    Instant lastSyncTime,
    ErrorReason errorReason,
    String errorMessage,
    String contentHash,
    int consecutiveFailures) {

  public static DescriptorStatus pending() {
    return new DescriptorStatus(SyncStatus.PENDING, SyncPhase.PENDING, null, null, null, null, 0);
  }

  public DescriptorStatus withPhase(final SyncPhase next) {
    return new DescriptorStatus(
        status, next, lastSyncTime, errorReason, errorMessage, contentHash, consecutiveFailures);
  }

  /**
   * Moves an errored status back to PENDING once its retry starts, keeping the last error and the
   * failure count the backoff is computed from. Any other status is returned unchanged.
   */
  public DescriptorStatus retrying() {
    if (status != SyncStatus.ERROR) return this;
    return new DescriptorStatus(
        SyncStatus.PENDING,
        SyncPhase.PENDING,
        lastSyncTime,
        errorReason,
        errorMessage,
        contentHash,
        consecutiveFailures);
  }

  public DescriptorStatus synced(final Instant at, final String hash) {
    return new DescriptorStatus(SyncStatus.SYNCED, SyncPhase.SYNCED, at, null, null, hash, 0);
  }

  public DescriptorStatus failed(final ErrorReason reason, final String message) {
    return new DescriptorStatus(
        SyncStatus.ERROR,
        SyncPhase.ERROR,
        lastSyncTime,
        reason,
        message,
        contentHash,
        consecutiveFailures + 1);
  }
}
