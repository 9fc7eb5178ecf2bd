package com.example.secretsync.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Template block of a descriptor: the declared secret type plus one template text per output key.
 *
 * @param type declared secret type (for example {@code Opaque})
 * @param data output key to template text, in declaration order
 */
public record SecretTemplate(String type, Map<String, String> data) {

  public static final String DEFAULT_TYPE = "Opaque";

  public SecretTemplate {
    if (type == null || type.isBlank()) type = DEFAULT_TYPE;
    if (data == null || data.isEmpty())
      throw new IllegalArgumentException("template requires at least one data entry");
    data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  /**
   * Template producing a single blob under {@code key}.
   *
   * @param key output key
   * @param text template text
   * @return template with one entry
   */
  public static SecretTemplate single(final String key, final String text) {
    return new SecretTemplate(DEFAULT_TYPE, Map.of(key, text));
  }
}
