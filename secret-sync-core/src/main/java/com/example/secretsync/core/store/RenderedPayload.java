package com.example.secretsync.core.store;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Final content of a destination object as produced by one reconciliation pass: sorted field map,
 * secret type, owner marker and content hash.
 *
 * <p>The payload owns its buffers; {@link #close()} zeroes them. Stores copy what they keep.
 */
public final class RenderedPayload implements AutoCloseable {

  private final String type;
  private final SortedMap<String, byte[]> data;
  private final String ownerMarker;
  private final String contentHash;

  private RenderedPayload(
      final String type, final SortedMap<String, byte[]> data, final String ownerMarker) {
    this.type = type;
    this.data = data;
    this.ownerMarker = ownerMarker;
    this.contentHash = ContentHash.of(data);
  }

  /**
   * Creates a payload that takes ownership of the arrays in {@code data}.
   *
   * @param type secret type
   * @param data field name to bytes
   * @param ownerMarker owner written onto the destination object, may be {@code null}
   * @return the payload
   */
  public static RenderedPayload of(
      final String type, final Map<String, byte[]> data, final String ownerMarker) {
    return new RenderedPayload(type, new TreeMap<>(data), ownerMarker);
  }

  public String type() {
    return type;
  }

  /** Read-only view of the fields; the arrays must not be modified. */
  public SortedMap<String, byte[]> data() {
    return Collections.unmodifiableSortedMap(data);
  }

  public String ownerMarker() {
    return ownerMarker;
  }

  public String contentHash() {
    return contentHash;
  }

  @Override
  public void close() {
    data.values().forEach(value -> Arrays.fill(value, (byte) 0));
  }

  @Override
  public String toString() {
    return "RenderedPayload[fields=" + data.keySet() + ", owner=" + ownerMarker + "]";
  }
}
