package com.example.secretsync.core.model;

/**
 * Pulls many fields at once from a backend.
 *
 * <ul>
 *   <li>{@link Mode#EXTRACT}: the remote value at {@code key} is a JSON object; each of its
 *       top-level properties becomes a field.
 *   <li>{@link Mode#FIND}: every remote key under the {@code key} prefix becomes a field named
 *       after the key's path relative to the prefix, with {@code /} replaced by {@code _}.
 * </ul>
 *
 * @param mode how the source expands
 * @param key remote key or prefix
 */
public record BulkSource(Mode mode, String key) {

  public enum Mode {
    EXTRACT,
    FIND
  }

  public BulkSource {
    if (mode == null) throw new IllegalArgumentException("mode is required");
    if (key == null) throw new IllegalArgumentException("key is required");
    if (mode == Mode.EXTRACT && key.isBlank())
      throw new IllegalArgumentException("extract requires a remote key");
  }

  public static BulkSource extract(final String key) {
    return new BulkSource(Mode.EXTRACT, key);
  }

  public static BulkSource find(final String prefix) {
    return new BulkSource(Mode.FIND, prefix);
  }
}
