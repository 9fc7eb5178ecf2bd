package com.example.secretsync.core;

import java.util.Objects;

/**
 * Unchecked failure raised anywhere along a reconciliation pass, tagged with the {@link
 * ErrorReason} that ends up on the descriptor status.
 *
 * <p>Messages never contain secret material, only keys, properties and backend names.
 */
public class SyncException extends RuntimeException {

  private final ErrorReason reason;

  public SyncException(final ErrorReason reason, final String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public SyncException(final ErrorReason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public ErrorReason reason() {
    return reason;
  }

  public static SyncException notFound(final String message) {
    return new SyncException(ErrorReason.NOT_FOUND, message);
  }

  public static SyncException authError(final String message, final Throwable cause) {
    return new SyncException(ErrorReason.AUTH_ERROR, message, cause);
  }

  public static SyncException unreachable(final String message, final Throwable cause) {
    return new SyncException(ErrorReason.UNREACHABLE, message, cause);
  }

  public static SyncException missingField(final String field) {
    return new SyncException(
        ErrorReason.MISSING_FIELD, "template references unmapped field '" + field + "'");
  }

  public static SyncException templateSyntax(final String message) {
    return new SyncException(ErrorReason.TEMPLATE_SYNTAX_ERROR, message);
  }

  public static SyncException conflict(final String message) {
    return new SyncException(ErrorReason.CONFLICT, message);
  }

  public static SyncException timeout(final String message) {
    return new SyncException(ErrorReason.TIMEOUT, message);
  }

  public static SyncException cancelled(final String message) {
    return new SyncException(ErrorReason.CANCELLED, message);
  }

  /**
   * Maps any throwable to a {@link SyncException}, keeping the reason of an existing one and
   * classifying everything else as {@link ErrorReason#INTERNAL}.
   *
   * @param error the failure to classify
   * @return the given exception or a wrapping one
   */
  public static SyncException from(final Throwable error) {
    if (error instanceof SyncException sync) return sync;
    return new SyncException(
        ErrorReason.INTERNAL,
        Objects.requireNonNullElse(error.getMessage(), error.getClass().getSimpleName()),
        error);
  }
}
