package com.example.secretsync.core.store;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.secretsync.core.SyncException;
import com.example.secretsync.core.model.SecretIdentity;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link SecretStore} held in memory. Resource versions come from one store-wide counter, so a
 * version is never reused, even across delete and re-create.
 */
public class InMemorySecretStore implements SecretStore {

  private static final System.Logger LOGGER = System.getLogger(InMemorySecretStore.class.getName());

  private final ConcurrentHashMap<SecretIdentity, StoreObjectHandle> objects =
      new ConcurrentHashMap<>();
  private final AtomicLong versions = new AtomicLong();

  @Override
  public Optional<StoreObjectHandle> get(final SecretIdentity identity) {
    return Optional.ofNullable(objects.get(identity));
  }

  @Override
  public StoreObjectHandle create(final SecretIdentity identity, final RenderedPayload payload) {
    final var created = toHandle(identity, payload);
    final var previous = objects.putIfAbsent(identity, created);
    if (previous != null) throw SyncException.conflict("object " + identity + " already exists");
    LOGGER.log(DEBUG, "Created {0} at version {1}", identity, created.resourceVersion());
    return created;
  }

  @Override
  public StoreObjectHandle update(
      final SecretIdentity identity, final RenderedPayload payload, final String resourceVersion) {
    final var stale = new AtomicBoolean(false);
    final var updated =
        objects.computeIfPresent(
            identity,
            (id, current) -> {
              if (current.resourceVersion().equals(resourceVersion)) return toHandle(id, payload);
              stale.set(true);
              return current;
            });
    if (updated == null)
      throw SyncException.conflict("object " + identity + " disappeared before update");
    if (stale.get())
      throw SyncException.conflict(
          "object " + identity + " changed since version " + resourceVersion);
    LOGGER.log(DEBUG, "Updated {0} to version {1}", identity, updated.resourceVersion());
    return updated;
  }

  @Override
  public boolean delete(final SecretIdentity identity) {
    return objects.remove(identity) != null;
  }

  /**
   * Writes an object directly, bypassing ownership rules, as another writer of the store would.
   *
   * @return the stored handle
   */
  public StoreObjectHandle put(final SecretIdentity identity, final RenderedPayload payload) {
    final var handle = toHandle(identity, payload);
    objects.put(identity, handle);
    return handle;
  }

  public List<SecretIdentity> identities() {
    return objects.keySet().stream().sorted().toList();
  }

  private StoreObjectHandle toHandle(final SecretIdentity identity, final RenderedPayload payload) {
    return StoreObjectHandle.of(
        identity,
        payload.type(),
        payload.data(),
        payload.ownerMarker(),
        Long.toString(versions.incrementAndGet()));
  }
}
