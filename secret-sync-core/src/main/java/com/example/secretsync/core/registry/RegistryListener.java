package com.example.secretsync.core.registry;

import com.example.secretsync.core.model.SecretDescriptor;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/** Receives registry mutations, on the mutating thread, while the registry's write lock is held. */
public interface RegistryListener {

  default void descriptorAdded(final SecretDescriptor descriptor) {}

  default void descriptorUpdated(final SecretDescriptor previous, final SecretDescriptor current) {}

  /**
   * Called when a descriptor is removed. The registry cleans up the destination object only once
   * the returned stage completes.
   *
   * @return completes when no work for the removed descriptor is running any more
   */
  default CompletionStage<Void> descriptorRemoved(final SecretDescriptor removed) {
    return CompletableFuture.completedFuture(null);
  }
}
