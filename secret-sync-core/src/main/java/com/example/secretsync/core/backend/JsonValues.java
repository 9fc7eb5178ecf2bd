package com.example.secretsync.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/** Property selection inside JSON secret payloads, shared by the backends. */
public final class JsonValues {

  private JsonValues() {}

  /**
   * Selects {@code property} from {@code root}. An exact top-level field wins; otherwise the
   * property is read as a dotted path ({@code db.primary.password}).
   */
  public static Optional<JsonNode> select(final JsonNode root, final String property) {
    if (root == null || !root.isObject()) return Optional.empty();
    final var direct = root.get(property);
    if (direct != null && !direct.isNull()) return Optional.of(direct);

    var current = root;
    for (final var part : property.split("\\.")) {
      if (current == null || !current.isObject()) return Optional.empty();
      current = current.get(part);
    }
    return Optional.ofNullable(current).filter(n -> !n.isNull() && !n.isMissingNode());
  }

  /** Text nodes give their raw text, everything else its JSON form. */
  public static byte[] toBytes(final JsonNode node) {
    final var text = node.isTextual() ? node.textValue() : node.toString();
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
