package com.example.secretsync.core.model;

import java.util.Objects;

/**
 * Identity of a descriptor and of the destination object it owns.
 *
 * @param namespace namespace of the secret
 * @param name name of the secret
 */
public record SecretIdentity(String namespace, String name) implements Comparable<SecretIdentity> {

  public SecretIdentity {
    if (namespace == null || namespace.isBlank())
      throw new IllegalArgumentException("namespace is required");
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
  }

  public static SecretIdentity of(final String namespace, final String name) {
    return new SecretIdentity(namespace, name);
  }

  /**
   * Parses the {@code namespace/name} form produced by {@link #toString()}.
   *
   * @param value rendered identity
   * @return parsed identity
   */
  public static SecretIdentity parse(final String value) {
    Objects.requireNonNull(value, "value");
    final var slash = value.indexOf('/');
    if (slash <= 0 || slash == value.length() - 1)
      throw new IllegalArgumentException("expected namespace/name but got '" + value + "'");
    return new SecretIdentity(value.substring(0, slash), value.substring(slash + 1));
  }

  @Override
  public int compareTo(final SecretIdentity other) {
    final var byNamespace = namespace.compareTo(other.namespace);
    return byNamespace != 0 ? byNamespace : name.compareTo(other.name);
  }

  @Override
  public String toString() {
    return namespace + "/" + name;
  }
}
