package com.example.secretsync.core;

import com.example.secretsync.core.backend.BackendClient;
import com.example.secretsync.core.backend.ResolvedSecretValue;
import com.example.secretsync.core.model.BackendHealth;
import com.example.secretsync.core.model.BackendKind;
import com.example.secretsync.core.model.BackendRef;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory backend holding JSON objects or raw strings per remote key. */
public class FakeBackendClient implements BackendClient {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final BackendRef ref;
  private final Map<String, String> values = new ConcurrentHashMap<>();
  private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
  private final List<ResolvedSecretValue> issued = new CopyOnWriteArrayList<>();
  private final AtomicInteger fetches = new AtomicInteger();
  private volatile BackendHealth health = BackendHealth.HEALTHY;
  private volatile Runnable beforeFetch = () -> {};
  private volatile boolean closed;

  public FakeBackendClient(final BackendRef ref) {
    this.ref = ref;
  }

  public FakeBackendClient() {
    this(BackendRef.builder().name("fake").kind(BackendKind.CLOUD_SECRETS_MANAGER).build());
  }

  public FakeBackendClient put(final String remoteKey, final Map<String, String> properties) {
    try {
      values.put(remoteKey, MAPPER.writeValueAsString(properties));
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
    return this;
  }

  public FakeBackendClient putRaw(final String remoteKey, final String value) {
    values.put(remoteKey, value);
    return this;
  }

  public FakeBackendClient fail(final String remoteKey, final RuntimeException failure) {
    failures.put(remoteKey, failure);
    return this;
  }

  public FakeBackendClient clearFailures() {
    failures.clear();
    return this;
  }

  /** Runs before every fetch, e.g. to block on a latch. */
  public FakeBackendClient beforeFetch(final Runnable hook) {
    this.beforeFetch = hook;
    return this;
  }

  public void health(final BackendHealth health) {
    this.health = health;
  }

  public int fetchCount() {
    return fetches.get();
  }

  /** Every value handed out so far. */
  public List<ResolvedSecretValue> issued() {
    return new ArrayList<>(issued);
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public BackendRef ref() {
    return ref;
  }

  @Override
  public ResolvedSecretValue fetch(final String remoteKey, final String property) {
    fetches.incrementAndGet();
    beforeFetch.run();
    final var failure = failures.get(remoteKey);
    if (failure != null) throw failure;

    final var raw = values.get(remoteKey);
    if (raw == null) throw SyncException.notFound("key " + remoteKey + " not found");

    final String value;
    if (property == null) {
      value = raw;
    } else {
      try {
        final var node = MAPPER.readTree(raw).get(property);
        if (node == null) throw SyncException.notFound("property " + property + " not found");
        value = node.asText();
      } catch (final JsonProcessingException e) {
        throw SyncException.notFound("key " + remoteKey + " is not JSON");
      }
    }
    final var resolved = ResolvedSecretValue.ofString(remoteKey, property, value, "1");
    issued.add(resolved);
    return resolved;
  }

  @Override
  public List<String> listKeys(final String prefix) {
    final var failure = failures.get(prefix);
    if (failure != null) throw failure;
    return values.keySet().stream().filter(k -> k.startsWith(prefix)).sorted().toList();
  }

  @Override
  public BackendHealth healthCheck() {
    return health;
  }

  @Override
  public void close() {
    closed = true;
  }
}
