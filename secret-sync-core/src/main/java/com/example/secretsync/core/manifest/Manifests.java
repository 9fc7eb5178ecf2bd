package com.example.secretsync.core.manifest;

import com.example.secretsync.core.model.BackendRef;
import com.example.secretsync.core.model.SecretDescriptor;
import java.util.List;

/**
 * Backends and descriptors declared by one manifest set.
 *
 * @param backends declared backends, in document order
 * @param descriptors declared descriptors, in document order
 */
public record Manifests(List<BackendRef> backends, List<SecretDescriptor> descriptors) {

  public Manifests {
    backends = List.copyOf(backends);
    descriptors = List.copyOf(descriptors);
  }

  public static Manifests empty() {
    return new Manifests(List.of(), List.of());
  }
}
