package com.example.secretsync.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Identity and connection parameters of one external secret source.
 *
 * <p>Everything except the health status is fixed at construction; a configuration change produces
 * a new instance. Health is updated by health checks only.
 */
public final class BackendRef {

  /** Auth method for Vault-like backends that read a static token. */
  public static final String AUTH_TOKEN = "token";

  /** Auth method that defers to the SDK's default credential chain. */
  public static final String AUTH_DEFAULT = "default";

  /** Parameter limiting concurrent calls to the backend; a positive integer. */
  public static final String MAX_CONCURRENCY = "maxConcurrency";

  private final String name;
  private final String namespace;
  private final BackendKind kind;
  private final URI server;
  private final String authMethod;
  private final String pathPrefix;
  private final String backendNamespace;
  private final Map<String, String> parameters;
  private final AtomicReference<BackendHealth> health =
      new AtomicReference<>(BackendHealth.UNKNOWN);

  private BackendRef(final Builder builder) {
    this.name = builder.name;
    this.namespace = builder.namespace;
    this.kind = builder.kind;
    this.server = builder.server;
    this.authMethod = builder.authMethod;
    this.pathPrefix = builder.pathPrefix;
    this.backendNamespace = builder.backendNamespace;
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
  }

  public static Builder builder() {
    return new Builder();
  }

  static String clusterKey(final String name) {
    return "cluster/" + name;
  }

  static String namespacedKey(final String namespace, final String name) {
    return namespace + "/" + name;
  }

  /** Registry key: {@code cluster/<name>} or {@code <namespace>/<name>}. */
  public String key() {
    return namespace == null ? clusterKey(name) : namespacedKey(namespace, name);
  }

  public String name() {
    return name;
  }

  /** Namespace of a namespaced backend; empty for cluster-scoped ones. */
  public Optional<String> namespace() {
    return Optional.ofNullable(namespace);
  }

  public boolean isClusterScoped() {
    return namespace == null;
  }

  public BackendKind kind() {
    return kind;
  }

  public Optional<URI> server() {
    return Optional.ofNullable(server);
  }

  public String authMethod() {
    return authMethod;
  }

  /** Prefix prepended to every remote key, e.g. a KV mount or a secret-name prefix. */
  public String pathPrefix() {
    return pathPrefix;
  }

  /** Tenant namespace inside the backend (Vault enterprise namespaces), if any. */
  public Optional<String> backendNamespace() {
    return Optional.ofNullable(backendNamespace);
  }

  public Map<String, String> parameters() {
    return parameters;
  }

  public Optional<String> parameter(final String key) {
    return Optional.ofNullable(parameters.get(key)).filter(v -> !v.isBlank());
  }

  /** Value of the {@value #MAX_CONCURRENCY} parameter, validated when the ref was built. */
  public Optional<Integer> maxConcurrency() {
    return parameter(MAX_CONCURRENCY).map(value -> Integer.parseInt(value.strip()));
  }

  public BackendHealth health() {
    return health.get();
  }

  /**
   * Records a health-check result.
   *
   * @param next new health
   * @return the previous health
   */
  public BackendHealth updateHealth(final BackendHealth next) {
    return health.getAndSet(Objects.requireNonNull(next, "health"));
  }

  /** Whether {@code other} describes the same connection, ignoring health. */
  public boolean sameConnection(final BackendRef other) {
    return other != null
        && name.equals(other.name)
        && Objects.equals(namespace, other.namespace)
        && kind == other.kind
        && Objects.equals(server, other.server)
        && authMethod.equals(other.authMethod)
        && pathPrefix.equals(other.pathPrefix)
        && Objects.equals(backendNamespace, other.backendNamespace)
        && parameters.equals(other.parameters);
  }

  @Override
  public String toString() {
    return "BackendRef[" + key() + ", kind=" + kind + ", health=" + health.get() + "]";
  }

  public static class Builder {
    private String name;
    private String namespace;
    private BackendKind kind;
    private URI server;
    private String authMethod;
    private String pathPrefix = "";
    private String backendNamespace;
    private final Map<String, String> parameters = new LinkedHashMap<>();

    private Builder() {}

    public Builder name(final String name) {
      this.name = name;
      return this;
    }

    /** Namespace of a namespaced backend; leave unset for a cluster-scoped backend. */
    public Builder namespace(final String namespace) {
      this.namespace = namespace;
      return this;
    }

    public Builder kind(final BackendKind kind) {
      this.kind = kind;
      return this;
    }

    public Builder server(final URI server) {
      this.server = server;
      return this;
    }

    public Builder authMethod(final String authMethod) {
      this.authMethod = authMethod;
      return this;
    }

    public Builder pathPrefix(final String pathPrefix) {
      this.pathPrefix = pathPrefix;
      return this;
    }

    public Builder backendNamespace(final String backendNamespace) {
      this.backendNamespace = backendNamespace;
      return this;
    }

    public Builder parameter(final String key, final String value) {
      if (value != null) parameters.put(key, value);
      return this;
    }

    public Builder parameters(final Map<String, String> values) {
      values.forEach(this::parameter);
      return this;
    }

    public BackendRef build() {
      if (name == null || name.isBlank()) throw new IllegalStateException("name is required");
      if (kind == null) throw new IllegalStateException("kind is required for backend " + name);
      if (namespace != null && namespace.isBlank()) namespace = null;
      if (kind == BackendKind.VAULT_LIKE && server == null)
        throw new IllegalStateException("server is required for Vault-like backend " + name);
      if (authMethod == null || authMethod.isBlank())
        authMethod = kind == BackendKind.VAULT_LIKE ? AUTH_TOKEN : AUTH_DEFAULT;
      if (pathPrefix == null) pathPrefix = "";
      final var maxConcurrency = parameters.get(MAX_CONCURRENCY);
      if (maxConcurrency != null && !maxConcurrency.isBlank()) validPermits(maxConcurrency);
      return new BackendRef(this);
    }

    private void validPermits(final String value) {
      final int permits;
      try {
        permits = Integer.parseInt(value.strip());
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException(
            MAX_CONCURRENCY + " of backend " + name + " must be an integer but was '" + value + "'",
            e);
      }
      if (permits < 1)
        throw new IllegalArgumentException(
            MAX_CONCURRENCY + " of backend " + name + " must be >= 1 but was " + permits);
    }
  }
}
