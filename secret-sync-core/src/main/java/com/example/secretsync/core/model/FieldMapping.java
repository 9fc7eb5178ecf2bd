package com.example.secretsync.core.model;

/**
 * Maps one local key of the destination object to a remote key and optional property.
 *
 * @param secretKey key written to the destination object
 * @param remoteKey key (or path) in the backend
 * @param property property inside the remote value, or {@code null} for the whole value
 */
public record FieldMapping(String secretKey, String remoteKey, String property) {

  public FieldMapping {
    if (secretKey == null || secretKey.isBlank())
      throw new IllegalArgumentException("secretKey is required");
    if (remoteKey == null || remoteKey.isBlank())
      throw new IllegalArgumentException("remoteKey is required for " + secretKey);
    if (property != null && property.isBlank()) property = null;
  }
}
