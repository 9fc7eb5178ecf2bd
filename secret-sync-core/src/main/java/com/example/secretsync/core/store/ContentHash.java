package com.example.secretsync.core.store;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/** SHA-256 over a key-value payload, independent of map iteration order. */
public final class ContentHash {

  private ContentHash() {}

  /**
   * Hashes {@code data}. Keys are visited in sorted order and every key and value is
   * length-prefixed, so distinct payloads cannot collide by concatenation.
   *
   * @param data payload
   * @return lowercase hex digest
   */
  public static String of(final Map<String, byte[]> data) {
    final MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("SHA-256");
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
    final var length = ByteBuffer.allocate(Integer.BYTES);
    for (final var entry : new TreeMap<>(data).entrySet()) {
      final var key = entry.getKey().getBytes(StandardCharsets.UTF_8);
      digest.update(length.clear().putInt(key.length).array());
      digest.update(key);
      digest.update(length.clear().putInt(entry.getValue().length).array());
      digest.update(entry.getValue());
    }
    return HexFormat.of().formatHex(digest.digest());
  }
}
