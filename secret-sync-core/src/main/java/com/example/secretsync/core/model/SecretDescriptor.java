package com.example.secretsync.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Desired state of one synchronized secret together with its observed status.
 *
 * <p>The desired-state part is immutable; a configuration change registers a new instance. The
 * status is replaced atomically by the reconciliation engine and may be read concurrently.
 *
 * <pre>{@code
 * var descriptor = SecretDescriptor.builder()
 *     .identity(SecretIdentity.of("payments", "db-credentials"))
 *     .backend(BackendSelector.cluster("vault"))
 *     .mapping("username", "database/postgres", "username")
 *     .mapping("password", "database/postgres", "password")
 *     .refreshInterval(Duration.ofSeconds(15))
 *     .creationPolicy(CreationPolicy.OWNER)
 *     .build();
 * }</pre>
 */
public final class SecretDescriptor {

  private final SecretIdentity identity;
  private final BackendSelector backend;
  private final List<FieldMapping> mappings;
  private final List<BulkSource> bulkSources;
  private final SecretTemplate template;
  private final Duration refreshInterval;
  private final CreationPolicy creationPolicy;
  private final boolean deleteOnRemoval;
  private final AtomicReference<DescriptorStatus> status =
      new AtomicReference<>(DescriptorStatus.pending());

  private SecretDescriptor(final Builder builder) {
    this.identity = builder.identity;
    this.backend = builder.backend;
    this.mappings = List.copyOf(builder.mappings);
    this.bulkSources = List.copyOf(builder.bulkSources);
    this.template = builder.template;
    this.refreshInterval = builder.refreshInterval;
    this.creationPolicy = builder.creationPolicy;
    this.deleteOnRemoval = builder.deleteOnRemoval;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SecretIdentity identity() {
    return identity;
  }

  public BackendSelector backend() {
    return backend;
  }

  /** Registry key of the referenced backend. */
  public String backendKey() {
    return backend.keyFor(identity.namespace());
  }

  public List<FieldMapping> mappings() {
    return mappings;
  }

  public List<BulkSource> bulkSources() {
    return bulkSources;
  }

  public Optional<SecretTemplate> template() {
    return Optional.ofNullable(template);
  }

  public Duration refreshInterval() {
    return refreshInterval;
  }

  public CreationPolicy creationPolicy() {
    return creationPolicy;
  }

  /** Whether the destination object is deleted when this descriptor is removed. */
  public boolean deleteOnRemoval() {
    return deleteOnRemoval;
  }

  public DescriptorStatus status() {
    return status.get();
  }

  public DescriptorStatus updateStatus(final UnaryOperator<DescriptorStatus> update) {
    return status.updateAndGet(update);
  }

  /**
   * Whether {@code other} produces its payload differently from this descriptor: a different
   * backend, mappings, bulk sources or template.
   */
  public boolean payloadSpecDiffers(final SecretDescriptor other) {
    return !backend.equals(other.backend)
        || !mappings.equals(other.mappings)
        || !bulkSources.equals(other.bulkSources)
        || !Objects.equals(template, other.template);
  }

  /** Whether {@code other} has the same desired state in every respect. */
  public boolean sameSpec(final SecretDescriptor other) {
    return identity.equals(other.identity)
        && !payloadSpecDiffers(other)
        && refreshInterval.equals(other.refreshInterval)
        && creationPolicy == other.creationPolicy
        && deleteOnRemoval == other.deleteOnRemoval;
  }

  @Override
  public String toString() {
    return "SecretDescriptor["
        + identity
        + ", backend="
        + backendKey()
        + ", status="
        + status.get().status()
        + "]";
  }

  public static class Builder {
    private SecretIdentity identity;
    private BackendSelector backend;
    private final List<FieldMapping> mappings = new ArrayList<>();
    private final List<BulkSource> bulkSources = new ArrayList<>();
    private SecretTemplate template;
    private Duration refreshInterval = Duration.ofHours(1);
    private CreationPolicy creationPolicy = CreationPolicy.OWNER;
    private boolean deleteOnRemoval = true;

    private Builder() {}

    public Builder identity(final SecretIdentity identity) {
      this.identity = identity;
      return this;
    }

    public Builder backend(final BackendSelector backend) {
      this.backend = backend;
      return this;
    }

    public Builder mapping(final FieldMapping mapping) {
      this.mappings.add(mapping);
      return this;
    }

    public Builder mapping(final String secretKey, final String remoteKey, final String property) {
      return mapping(new FieldMapping(secretKey, remoteKey, property));
    }

    public Builder bulkSource(final BulkSource source) {
      this.bulkSources.add(source);
      return this;
    }

    public Builder template(final SecretTemplate template) {
      this.template = template;
      return this;
    }

    public Builder refreshInterval(final Duration refreshInterval) {
      this.refreshInterval = refreshInterval;
      return this;
    }

    public Builder creationPolicy(final CreationPolicy creationPolicy) {
      this.creationPolicy = creationPolicy;
      return this;
    }

    public Builder deleteOnRemoval(final boolean deleteOnRemoval) {
      this.deleteOnRemoval = deleteOnRemoval;
      return this;
    }

    /**
     * Builds the descriptor.
     *
     * @return validated descriptor
     * @throws IllegalStateException if identity or backend is missing, mapping keys repeat, or
     *     there is nothing to build a payload from
     * @throws IllegalArgumentException if the refresh interval is not positive
     */
    public SecretDescriptor build() {
      if (identity == null) throw new IllegalStateException("identity is required");
      if (backend == null) throw new IllegalStateException("backend is required for " + identity);
      if (creationPolicy == null)
        throw new IllegalStateException("creationPolicy is required for " + identity);
      if (refreshInterval == null || refreshInterval.isZero() || refreshInterval.isNegative())
        throw new IllegalArgumentException("refreshInterval must be > 0 for " + identity);
      if (mappings.isEmpty() && bulkSources.isEmpty() && template == null)
        throw new IllegalStateException(
            "descriptor " + identity + " needs field mappings, bulk sources or a template");

      final var keys = new HashSet<String>();
      for (final var mapping : mappings)
        if (!keys.add(mapping.secretKey()))
          throw new IllegalStateException(
              "duplicate secretKey '" + mapping.secretKey() + "' in " + identity);

      return new SecretDescriptor(this);
    }
  }
}
