package com.example.secretsync.core;

/**
 * Failure taxonomy recorded on a descriptor when a reconciliation pass does not complete.
 *
 * <p>{@link #isTransient()} tells whether a retry with backoff can be expected to help without any
 * change to the descriptor. All reasons are still retried on schedule.
 */
public enum ErrorReason {
  NOT_FOUND(false),
  AUTH_ERROR(true),
  UNREACHABLE(true),
  TEMPLATE_SYNTAX_ERROR(false),
  MISSING_FIELD(false),
  OWNERSHIP_CONFLICT(false),
  CONFLICT(true),
  TIMEOUT(true),
  NOT_FOUND_AND_CREATION_FORBIDDEN(false),
  BACKEND_NOT_FOUND(false),
  CANCELLED(false),
  INTERNAL(true);

  private final boolean transientFailure;

  ErrorReason(final boolean transientFailure) {
    this.transientFailure = transientFailure;
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
