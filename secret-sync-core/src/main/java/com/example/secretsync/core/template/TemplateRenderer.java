package com.example.secretsync.core.template;

import com.example.secretsync.core.SyncException;
import com.example.secretsync.core.model.SecretTemplate;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Renders secret templates against resolved field values.
 *
 * <p>Placeholders take the form {@code {{ .field }}}, optionally followed by a pipeline of
 * functions: {@code {{ .password | base64encode }}}. Supported functions are {@code base64encode},
 * {@code base64decode}, {@code upper}, {@code lower} and {@code trim}. Text outside placeholders
 * is copied verbatim; a lone {@code }}} is literal text.
 *
 * <p>Rendering is pure: the same template and values always give the same bytes.
 *
 * <pre>{@code
 * var out = TemplateRenderer.render(
 *     "postgres://{{ .username }}:{{ .password }}@{{ .host }}/app",
 *     Map.of("username", bytes("admin"), "password", bytes("s3cr3t"), "host", bytes("db1")));
 * }</pre>
 */
public final class TemplateRenderer {

  private static final String OPEN = "{{";
  private static final String CLOSE = "}}";
  private static final Pattern FIELD = Pattern.compile("\\.([A-Za-z_][A-Za-z0-9_\\-]*)");

  private static final Map<String, UnaryOperator<byte[]>> FUNCTIONS =
      Map.of(
          "base64encode", value -> Base64.getEncoder().encode(value),
          "base64decode", TemplateRenderer::base64Decode,
          "upper", value -> mapText(value, text -> text.toUpperCase(Locale.ROOT)),
          "lower", value -> mapText(value, text -> text.toLowerCase(Locale.ROOT)),
          "trim", value -> mapText(value, String::strip));

  private TemplateRenderer() {}

  private record Placeholder(String field, List<String> functions) {}

  private interface Segment {}

  private record Literal(byte[] bytes) implements Segment {}

  private record Field(Placeholder placeholder) implements Segment {}

  /**
   * Renders every entry of {@code template}.
   *
   * @param template template block
   * @param values resolved field values
   * @return output key to rendered bytes, in the template's order
   * @throws SyncException with reason TEMPLATE_SYNTAX_ERROR or MISSING_FIELD
   */
  public static Map<String, byte[]> render(
      final SecretTemplate template, final Map<String, byte[]> values) {
    final var rendered = new LinkedHashMap<String, byte[]>();
    template.data().forEach((key, text) -> rendered.put(key, render(text, values)));
    return rendered;
  }

  /**
   * Renders one template text.
   *
   * @param text template text
   * @param values resolved field values
   * @return rendered bytes
   * @throws SyncException with reason TEMPLATE_SYNTAX_ERROR or MISSING_FIELD
   */
  public static byte[] render(final String text, final Map<String, byte[]> values) {
    final var out = new ByteArrayOutputStream();
    for (final var segment : parse(text)) {
      if (segment instanceof Literal literal) {
        out.writeBytes(literal.bytes());
      } else if (segment instanceof Field field) {
        final var placeholder = field.placeholder();
        final var value = values.get(placeholder.field());
        if (value == null) throw SyncException.missingField(placeholder.field());
        var result = value;
        for (final var function : placeholder.functions())
          result = FUNCTIONS.get(function).apply(result);
        out.writeBytes(result);
      }
    }
    return out.toByteArray();
  }

  /**
   * Lists the field names a template references, in order of first appearance.
   *
   * @throws SyncException with reason TEMPLATE_SYNTAX_ERROR if the template is malformed
   */
  public static Set<String> referencedFields(final SecretTemplate template) {
    final var fields = new LinkedHashSet<String>();
    template.data().values().forEach(text -> fields.addAll(referencedFields(text)));
    return fields;
  }

  public static Set<String> referencedFields(final String text) {
    final var fields = new LinkedHashSet<String>();
    for (final var segment : parse(text))
      if (segment instanceof Field field) fields.add(field.placeholder().field());
    return fields;
  }

  private static List<Segment> parse(final String text) {
    final var segments = new ArrayList<Segment>();
    var position = 0;
    while (position < text.length()) {
      final var open = text.indexOf(OPEN, position);
      if (open < 0) {
        segments.add(literal(text.substring(position)));
        break;
      }
      if (open > position) segments.add(literal(text.substring(position, open)));

      final var close = text.indexOf(CLOSE, open + OPEN.length());
      if (close < 0)
        throw SyncException.templateSyntax("unterminated placeholder at offset " + open);
      segments.add(new Field(parsePlaceholder(text.substring(open + OPEN.length(), close), open)));
      position = close + CLOSE.length();
    }
    return segments;
  }

  private static Placeholder parsePlaceholder(final String body, final int offset) {
    final var parts = body.split("\\|", -1);
    final var head = parts[0].strip();
    if (head.isEmpty()) throw SyncException.templateSyntax("empty placeholder at offset " + offset);

    final var matcher = FIELD.matcher(head);
    if (!matcher.matches())
      throw SyncException.templateSyntax(
          "placeholder '" + head + "' at offset " + offset + " must reference a field as .name");

    final var functions = new ArrayList<String>();
    for (var i = 1; i < parts.length; i++) {
      final var function = parts[i].strip();
      if (!FUNCTIONS.containsKey(function))
        throw SyncException.templateSyntax(
            "unknown function '" + function + "' at offset " + offset);
      functions.add(function);
    }
    return new Placeholder(matcher.group(1), List.copyOf(functions));
  }

  private static Literal literal(final String text) {
    return new Literal(text.getBytes(StandardCharsets.UTF_8));
  }

  private static byte[] mapText(final byte[] value, final UnaryOperator<String> function) {
    return function
        .apply(new String(value, StandardCharsets.UTF_8))
        .getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] base64Decode(final byte[] value) {
    try {
      return Base64.getDecoder().decode(value);
    } catch (final IllegalArgumentException e) {
      throw SyncException.templateSyntax("base64decode applied to a value that is not base64");
    }
  }
}
