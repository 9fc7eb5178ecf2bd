package com.example.secretsync.core.manifest;

/** Raised when a manifest set cannot be read or describes an invalid object. */
public class ManifestException extends RuntimeException {

  public ManifestException(final String message) {
    super(message);
  }

  public ManifestException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
