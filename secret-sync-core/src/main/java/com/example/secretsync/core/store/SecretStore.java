package com.example.secretsync.core.store;

import com.example.secretsync.core.SyncException;
import com.example.secretsync.core.model.SecretIdentity;
import java.util.Optional;

/**
 * Destination key-value secret store keyed by (namespace, name).
 *
 * <p>Every object carries an owner marker and a resource version used as optimistic concurrency
 * token. Implementations must make each call atomic.
 */
public interface SecretStore {

  /** Annotation key under which stores persist the owner marker. */
  String OWNER_ANNOTATION = "secretsync.example.com/owner";

  Optional<StoreObjectHandle> get(SecretIdentity identity);

  /**
   * Creates an object.
   *
   * @throws SyncException with reason CONFLICT if the object already exists
   */
  StoreObjectHandle create(SecretIdentity identity, RenderedPayload payload);

  /**
   * Replaces an object's fields, type and owner marker.
   *
   * @param resourceVersion version the caller last read
   * @throws SyncException with reason CONFLICT if the object changed or disappeared since
   */
  StoreObjectHandle update(
      SecretIdentity identity, RenderedPayload payload, String resourceVersion);

  /**
   * Deletes an object.
   *
   * @return {@code false} if it did not exist
   */
  boolean delete(SecretIdentity identity);
}
