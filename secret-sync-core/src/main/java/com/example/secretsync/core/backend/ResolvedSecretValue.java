package com.example.secretsync.core.backend;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Secret material fetched for one remote key/property during a single reconciliation pass.
 *
 * <p>Instances are never persisted. {@link #close()} zeroes the buffer; afterwards every accessor
 * fails. Callers get copies, so closing the value does not affect a payload already assembled from
 * it.
 */
public final class ResolvedSecretValue implements AutoCloseable {

  private final String remoteKey;
  private final String property;
  private final byte[] value;
  private final String revision;
  private volatile boolean closed;

  /**
   * Creates a value that takes ownership of {@code value}.
   *
   * @param remoteKey remote key the value was read from
   * @param property property inside the remote value, may be {@code null}
   * @param value raw bytes, owned by the new instance
   * @param revision backend version marker, may be {@code null}
   */
  public ResolvedSecretValue(
      final String remoteKey, final String property, final byte[] value, final String revision) {
    this.remoteKey = remoteKey;
    this.property = property;
    this.value = value;
    this.revision = revision;
  }

  public static ResolvedSecretValue ofString(
      final String remoteKey, final String property, final String value, final String revision) {
    return new ResolvedSecretValue(
        remoteKey, property, value.getBytes(StandardCharsets.UTF_8), revision);
  }

  public String remoteKey() {
    return remoteKey;
  }

  public Optional<String> property() {
    return Optional.ofNullable(property);
  }

  /** Version marker of the remote value, when the backend supports versioning. */
  public Optional<String> revision() {
    return Optional.ofNullable(revision);
  }

  /** Copy of the secret bytes. */
  public byte[] bytes() {
    ensureOpen();
    return value.clone();
  }

  public String asString() {
    ensureOpen();
    return new String(value, StandardCharsets.UTF_8);
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
    Arrays.fill(value, (byte) 0);
  }

  private void ensureOpen() {
    if (closed) throw new IllegalStateException("value for " + remoteKey + " already released");
  }

  @Override
  public String toString() {
    return "ResolvedSecretValue[" + remoteKey + (property == null ? "" : "#" + property) + "]";
  }
}
