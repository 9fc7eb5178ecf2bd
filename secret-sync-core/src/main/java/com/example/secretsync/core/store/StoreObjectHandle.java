package com.example.secretsync.core.store;

import com.example.secretsync.core.model.SecretIdentity;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Destination-side view of a stored secret object.
 *
 * @param identity object identity
 * @param type secret type
 * @param data fields, sorted by key
 * @param ownerMarker identity of the owning descriptor, {@code null} if unowned
 * @param contentHash content hash of {@code data}
 * @param resourceVersion concurrency token for updates
 */
public record StoreObjectHandle(
    SecretIdentity identity,
    String type,
    SortedMap<String, byte[]> data,
    String ownerMarker,
    String contentHash,
    String resourceVersion) {

  public StoreObjectHandle {
    final var copy = new TreeMap<String, byte[]>();
    data.forEach((key, value) -> copy.put(key, value.clone()));
    data = Collections.unmodifiableSortedMap(copy);
  }

  public static StoreObjectHandle of(
      final SecretIdentity identity,
      final String type,
      final Map<String, byte[]> data,
      final String ownerMarker,
      final String resourceVersion) {
    return new StoreObjectHandle(
        identity, type, new TreeMap<>(data), ownerMarker, ContentHash.of(data), resourceVersion);
  }

  public Optional<String> owner() {
    return Optional.ofNullable(ownerMarker);
  }

  public boolean isOwnedBy(final String marker) {
    return marker.equals(ownerMarker);
  }
}
