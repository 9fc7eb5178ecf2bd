package com.example.secretsync.core.registry;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.secretsync.core.model.CreationPolicy;
import com.example.secretsync.core.model.DescriptorStatus;
import com.example.secretsync.core.model.SecretDescriptor;
import com.example.secretsync.core.model.SecretIdentity;
import com.example.secretsync.core.store.SecretStore;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory index of desired-state descriptors.
 *
 * <p>Reads are lock-free. Every mutation goes through one lock, so listeners observe mutations in
 * the order they were applied.
 */
public final class DescriptorRegistry {

  private static final System.Logger LOGGER = System.getLogger(DescriptorRegistry.class.getName());

  /** Result of {@link #upsert(SecretDescriptor)}. */
  public enum Change {
    ADDED,
    UPDATED,
    UNCHANGED
  }

  private final SecretStore store;
  private final ConcurrentHashMap<SecretIdentity, SecretDescriptor> descriptors =
      new ConcurrentHashMap<>();
  private final ConcurrentHashMap<SecretIdentity, CompletableFuture<Void>> removals =
      new ConcurrentHashMap<>();
  private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();
  private final ReentrantLock mutation = new ReentrantLock();

  /**
   * @param store destination store, used to clean up after removed descriptors
   */
  public DescriptorRegistry(final SecretStore store) {
    this.store = store;
  }

  public void addListener(final RegistryListener listener) {
    listeners.add(listener);
  }

  /**
   * Adds a new descriptor.
   *
   * @throws IllegalStateException if the identity is already registered
   */
  public void add(final SecretDescriptor descriptor) {
    mutation.lock();
    try {
      if (descriptors.putIfAbsent(descriptor.identity(), descriptor) != null)
        throw new IllegalStateException("descriptor " + descriptor.identity() + " already exists");
      LOGGER.log(INFO, "event=descriptor_added descriptor={0}", descriptor.identity());
      listeners.forEach(l -> l.descriptorAdded(descriptor));
    } finally {
      mutation.unlock();
    }
  }

  /**
   * Replaces a registered descriptor. The status is carried over unless the way the payload is
   * built changed, in which case it restarts as PENDING.
   *
   * @return {@code false} if the registered descriptor already had the same desired state
   * @throws IllegalStateException if the identity is not registered
   */
  public boolean update(final SecretDescriptor descriptor) {
    mutation.lock();
    try {
      final var previous = descriptors.get(descriptor.identity());
      if (previous == null)
        throw new IllegalStateException("descriptor " + descriptor.identity() + " does not exist");
      if (previous.sameSpec(descriptor)) return false;

      final var carried =
          descriptor.payloadSpecDiffers(previous) ? DescriptorStatus.pending() : previous.status();
      descriptor.updateStatus(ignored -> carried);
      descriptors.put(descriptor.identity(), descriptor);
      LOGGER.log(
          INFO,
          "event=descriptor_updated descriptor={0} status={1}",
          descriptor.identity(),
          carried.status());
      listeners.forEach(l -> l.descriptorUpdated(previous, descriptor));
      return true;
    } finally {
      mutation.unlock();
    }
  }

  /** Adds or updates a descriptor. */
  public Change upsert(final SecretDescriptor descriptor) {
    mutation.lock();
    try {
      if (!descriptors.containsKey(descriptor.identity())) {
        add(descriptor);
        return Change.ADDED;
      }
      return update(descriptor) ? Change.UPDATED : Change.UNCHANGED;
    } finally {
      mutation.unlock();
    }
  }

  /**
   * Removes a descriptor. Listeners run first, so scheduled work is cancelled before cleanup. With
   * creation policy OWNER and deletion enabled, the destination object is then deleted if it still
   * carries this descriptor's owner marker.
   *
   * <p>Cleanup waits until every listener reports that the descriptor's work has stopped, so a
   * write of a pass still in flight cannot outlive it. Until then {@link #pendingRemoval} returns
   * an incomplete future for the identity.
   *
   * @return the removed descriptor, empty if it was not registered
   */
  public Optional<SecretDescriptor> remove(final SecretIdentity identity) {
    mutation.lock();
    try {
      final var removed = descriptors.remove(identity);
      if (removed == null) return Optional.empty();
      LOGGER.log(INFO, "event=descriptor_removed descriptor={0}", identity);
      final var stopped =
          listeners.stream()
              .map(l -> l.descriptorRemoved(removed).toCompletableFuture())
              .toArray(CompletableFuture<?>[]::new);
      final CompletableFuture<Void> cleaned =
          CompletableFuture.allOf(stopped)
              .handle(
                  (ignored, error) -> {
                    cleanUp(removed);
                    return null;
                  });
      if (!cleaned.isDone()) {
        LOGGER.log(DEBUG, "Cleanup of {0} waits for its in-flight pass", identity);
        removals.put(identity, cleaned);
        cleaned.whenComplete((ignored, error) -> removals.remove(identity, cleaned));
      }
      return Optional.of(removed);
    } finally {
      mutation.unlock();
    }
  }

  /**
   * Cleanup of a removed descriptor that is still waiting for its in-flight pass.
   *
   * @return completes once cleanup has run; already complete if none is pending
   */
  public CompletableFuture<Void> pendingRemoval(final SecretIdentity identity) {
    return removals.getOrDefault(identity, CompletableFuture.completedFuture(null));
  }

  public Optional<SecretDescriptor> get(final SecretIdentity identity) {
    return Optional.ofNullable(descriptors.get(identity));
  }

  /** All descriptors, sorted by identity. */
  public List<SecretDescriptor> list() {
    return descriptors.values().stream()
        .sorted((a, b) -> a.identity().compareTo(b.identity()))
        .toList();
  }

  /** Descriptors referencing the given backend key, sorted by identity. */
  public List<SecretDescriptor> listByBackend(final String backendKey) {
    return list().stream().filter(d -> d.backendKey().equals(backendKey)).toList();
  }

  public int size() {
    return descriptors.size();
  }

  private void cleanUp(final SecretDescriptor removed) {
    if (removed.creationPolicy() != CreationPolicy.OWNER || !removed.deleteOnRemoval()) return;

    final var identity = removed.identity();
    try {
      final var owned =
          store.get(identity).filter(handle -> handle.isOwnedBy(identity.toString())).isPresent();
      if (owned && store.delete(identity))
        LOGGER.log(INFO, "event=secret_deleted descriptor={0}", identity);
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Failed to delete secret of removed descriptor " + identity, e);
    }
  }
}
