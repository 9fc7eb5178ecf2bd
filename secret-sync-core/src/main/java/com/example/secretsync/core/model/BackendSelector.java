package com.example.secretsync.core.model;

/**
 * Reference from a descriptor to a backend by name. Cluster-scoped backends are visible from every
 * namespace, namespaced ones only from their own.
 *
 * @param name backend name
 * @param clusterScoped whether the reference targets a cluster-scoped backend
 */
public record BackendSelector(String name, boolean clusterScoped) {

  public BackendSelector {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
  }

  public static BackendSelector namespaced(final String name) {
    return new BackendSelector(name, false);
  }

  public static BackendSelector cluster(final String name) {
    return new BackendSelector(name, true);
  }

  /**
   * Key under which the referenced backend is registered, given the referencing namespace.
   *
   * @param namespace namespace of the referencing descriptor
   * @return lookup key
   */
  public String keyFor(final String namespace) {
    return clusterScoped ? BackendRef.clusterKey(name) : BackendRef.namespacedKey(namespace, name);
  }
}
