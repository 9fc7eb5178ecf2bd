package com.example.secretsync.core.backend;

import com.example.secretsync.core.model.BackendRef;

/** Builds the {@link BackendClient} for a backend when its configuration is loaded. */
@FunctionalInterface
public interface BackendClientFactory {
  BackendClient create(final BackendRef ref);
}
