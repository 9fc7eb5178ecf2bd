package com.example.secretsync.core.backend;

import com.example.secretsync.core.SyncException;
import com.example.secretsync.core.model.BackendHealth;
import com.example.secretsync.core.model.BackendRef;
import java.util.List;

/**
 * Read access to one external secret source, bound to a single {@link BackendRef}.
 *
 * <p>Implementations never cache values: every call reflects the current remote state. Failures
 * are reported as {@link SyncException} with reason {@code NOT_FOUND}, {@code AUTH_ERROR} or
 * {@code UNREACHABLE} so the engine can pick a retry policy.
 */
public interface BackendClient extends AutoCloseable {

  BackendRef ref();

  /**
   * Fetches one value.
   *
   * @param remoteKey key relative to the backend's path prefix
   * @param property property inside the remote value, or {@code null} for the whole value
   * @return the resolved value, owned by the caller
   * @throws SyncException on any failure
   */
  ResolvedSecretValue fetch(String remoteKey, String property);

  /**
   * Lists keys under a prefix.
   *
   * @param prefix prefix relative to the backend's path prefix, may be empty
   * @return keys relative to the backend's path prefix, sorted
   * @throws SyncException on any failure
   */
  List<String> listKeys(String prefix);

  /** Probes the backend; never throws. */
  BackendHealth healthCheck();

  @Override
  default void close() {}
}
