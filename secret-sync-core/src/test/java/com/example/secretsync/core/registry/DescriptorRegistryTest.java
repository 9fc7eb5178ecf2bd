package com.example.secretsync.core.registry;

import static org.junit.jupiter.api.Assertions.*;

import com.example.secretsync.core.ErrorReason;
import com.example.secretsync.core.model.BackendSelector;
import com.example.secretsync.core.model.CreationPolicy;
import com.example.secretsync.core.model.SecretDescriptor;
import com.example.secretsync.core.model.SecretIdentity;
import com.example.secretsync.core.model.SyncStatus;
import com.example.secretsync.core.store.InMemorySecretStore;
import com.example.secretsync.core.store.RenderedPayload;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class DescriptorRegistryTest {

  private static final SecretIdentity ID = SecretIdentity.of("payments", "db-credentials");

  private InMemorySecretStore store;
  private DescriptorRegistry registry;
  private List<String> events;

  @BeforeEach
  void setUp() {
    store = new InMemorySecretStore();
    registry = new DescriptorRegistry(store);
    events = new CopyOnWriteArrayList<>();
    registry.addListener(
        new RegistryListener() {
          @Override
          public void descriptorAdded(final SecretDescriptor descriptor) {
            events.add("added " + descriptor.identity());
          }

          @Override
          public void descriptorUpdated(
              final SecretDescriptor previous, final SecretDescriptor current) {
            events.add("updated " + current.identity());
          }

          @Override
          public CompletionStage<Void> descriptorRemoved(final SecretDescriptor removed) {
            events.add("removed " + removed.identity());
            return CompletableFuture.completedFuture(null);
          }
        });
  }

  private static SecretDescriptor.Builder descriptor(final SecretIdentity identity) {
    return SecretDescriptor.builder()
        .identity(identity)
        .backend(BackendSelector.cluster("vault"))
        .mapping("password", "database/postgres", "password")
        .refreshInterval(Duration.ofSeconds(15));
  }

  private void storeObject(final String owner) {
    store.put(ID, RenderedPayload.of("Opaque", Map.of("password", new byte[] {1}), owner));
  }

  @Test
  @DisplayName("Should add, get and list descriptors sorted by identity")
  void shouldAddAndList() {
    final var other = SecretIdentity.of("alpha", "api");
    registry.add(descriptor(ID).build());
    registry.add(descriptor(other).build());

    assertEquals(2, registry.size());
    assertTrue(registry.get(ID).isPresent());
    assertEquals(
        List.of(other, ID), registry.list().stream().map(SecretDescriptor::identity).toList());
    assertEquals(List.of("added " + ID, "added " + other), events);
  }

  @Test
  @DisplayName("Should reject a duplicate identity")
  void shouldRejectDuplicate() {
    registry.add(descriptor(ID).build());
    assertThrows(IllegalStateException.class, () -> registry.add(descriptor(ID).build()));
  }

  @Test
  @DisplayName("Should reject updating an unknown identity")
  void shouldRejectUnknownUpdate() {
    assertThrows(IllegalStateException.class, () -> registry.update(descriptor(ID).build()));
  }

  @Test
  @DisplayName("Should list descriptors by backend key")
  void shouldListByBackend() {
    registry.add(descriptor(ID).build());
    registry.add(
        descriptor(SecretIdentity.of("payments", "api"))
            .backend(BackendSelector.namespaced("aws"))
            .build());

    assertEquals(1, registry.listByBackend("cluster/vault").size());
    assertEquals(
        SecretIdentity.of("payments", "api"),
        registry.listByBackend("payments/aws").get(0).identity());
    assertTrue(registry.listByBackend("other/aws").isEmpty());
  }

  @Nested
  @DisplayName("Upsert")
  class Upsert {

    @Test
    @DisplayName("Should report added, unchanged and updated")
    void shouldReportChange() {
      assertEquals(DescriptorRegistry.Change.ADDED, registry.upsert(descriptor(ID).build()));
      assertEquals(DescriptorRegistry.Change.UNCHANGED, registry.upsert(descriptor(ID).build()));
      assertEquals(
          DescriptorRegistry.Change.UPDATED,
          registry.upsert(descriptor(ID).refreshInterval(Duration.ofMinutes(1)).build()));
      assertEquals(List.of("added " + ID, "updated " + ID), events);
    }

    @Test
    @DisplayName("Should carry the status over when only the schedule changes")
    void shouldCarryStatus() {
      final var first = descriptor(ID).build();
      registry.add(first);
      first.updateStatus(s -> s.synced(Instant.EPOCH, "hash"));

      registry.update(descriptor(ID).refreshInterval(Duration.ofMinutes(5)).build());
      final var status = registry.get(ID).orElseThrow().status();
      assertEquals(SyncStatus.SYNCED, status.status());
      assertEquals("hash", status.contentHash());
    }

    @Test
    @DisplayName("Should reset the status to pending when the payload definition changes")
    void shouldResetStatus() {
      final var first = descriptor(ID).build();
      registry.add(first);
      first.updateStatus(s -> s.failed(ErrorReason.NOT_FOUND, "missing"));

      registry.update(descriptor(ID).mapping("username", "database/postgres", "username").build());
      final var status = registry.get(ID).orElseThrow().status();
      assertEquals(SyncStatus.PENDING, status.status());
      assertEquals(0, status.consecutiveFailures());
    }
  }

  @Nested
  @DisplayName("Remove")
  class Remove {

    @Test
    @DisplayName("Should notify listeners and delete the owned object")
    void shouldDeleteOwnedObject() {
      registry.add(descriptor(ID).build());
      storeObject(ID.toString());

      assertTrue(registry.remove(ID).isPresent());
      assertTrue(store.get(ID).isEmpty());
      assertEquals("removed " + ID, events.get(events.size() - 1));
      assertTrue(registry.remove(ID).isEmpty());
    }

    @Test
    @DisplayName("Should keep an object owned by someone else")
    void shouldKeepForeignObject() {
      registry.add(descriptor(ID).build());
      storeObject("someone/else");

      registry.remove(ID);
      assertTrue(store.get(ID).isPresent());
    }

    @Test
    @DisplayName("Should keep the object when deletion is disabled")
    void shouldRespectDeleteOnRemoval() {
      registry.add(descriptor(ID).deleteOnRemoval(false).build());
      storeObject(ID.toString());

      registry.remove(ID);
      assertTrue(store.get(ID).isPresent());
    }

    @Test
    @DisplayName("Should never delete objects of merge descriptors")
    void shouldKeepMergedObject() {
      registry.add(descriptor(ID).creationPolicy(CreationPolicy.MERGE).build());
      storeObject(ID.toString());

      registry.remove(ID);
      assertTrue(store.get(ID).isPresent());
    }

    @Test
    @DisplayName("Should delete the owned object only after listeners report work stopped")
    void shouldDeferCleanupUntilStopped() {
      final var stopped = new CompletableFuture<Void>();
      registry.addListener(
          new RegistryListener() {
            @Override
            public CompletionStage<Void> descriptorRemoved(final SecretDescriptor removed) {
              return stopped;
            }
          });
      registry.add(descriptor(ID).build());

      registry.remove(ID);
      storeObject(ID.toString());
      final var cleanup = registry.pendingRemoval(ID);
      assertFalse(cleanup.isDone());
      assertTrue(store.get(ID).isPresent());

      stopped.complete(null);
      assertTrue(cleanup.isDone());
      assertTrue(store.get(ID).isEmpty());
    }

    @Test
    @DisplayName("Should report no pending cleanup for unknown identities")
    void shouldHaveNoPendingRemoval() {
      assertTrue(registry.pendingRemoval(ID).isDone());
    }
  }

  @Nested
  @DisplayName("Descriptor validation")
  class Validation {

    @Test
    @DisplayName("Should reject duplicate secret keys")
    void shouldRejectDuplicateKeys() {
      assertThrows(
          IllegalStateException.class,
          () -> descriptor(ID).mapping("password", "other", null).build());
    }

    @Test
    @DisplayName("Should reject a non-positive refresh interval")
    void shouldRejectZeroInterval() {
      assertThrows(
          IllegalArgumentException.class,
          () -> descriptor(ID).refreshInterval(Duration.ZERO).build());
    }

    @Test
    @DisplayName("Should require something to build a payload from")
    void shouldRequireSources() {
      assertThrows(
          IllegalStateException.class,
          () ->
              SecretDescriptor.builder()
                  .identity(ID)
                  .backend(BackendSelector.cluster("vault"))
                  .build());
    }
  }
}
