package com.example.secretsync.core.manifest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Pattern;

/** Parses duration strings in the {@code 1h30m}, {@code 15s}, {@code 1.5h} form. */
public final class Durations {

  private static final Pattern PART =
      Pattern.compile("(\\d+(?:\\.\\d+)?|\\.\\d+)(ns|us|µs|ms|s|m|h)");

  private static final Map<String, Long> NANOS_PER_UNIT =
      Map.of(
          "ns", 1L,
          "us", 1_000L,
          "µs", 1_000L,
          "ms", 1_000_000L,
          "s", 1_000_000_000L,
          "m", 60_000_000_000L,
          "h", 3_600_000_000_000L);

  private Durations() {}

  /**
   * Parses a duration.
   *
   * @param text duration such as {@code 1h30m} or {@code 250ms}; {@code 0} is accepted
   * @return parsed duration
   * @throws IllegalArgumentException if the text is not a valid duration
   */
  public static Duration parse(final String text) {
    if (text == null || text.isBlank()) throw new IllegalArgumentException("empty duration");
    final var value = text.strip();
    if (value.equals("0")) return Duration.ZERO;

    final var matcher = PART.matcher(value);
    var total = BigDecimal.ZERO;
    var position = 0;
    while (position < value.length()) {
      if (!matcher.find(position) || matcher.start() != position)
        throw new IllegalArgumentException("invalid duration '" + text + "'");
      final var nanos = BigDecimal.valueOf(NANOS_PER_UNIT.get(matcher.group(2)));
      total = total.add(new BigDecimal(matcher.group(1)).multiply(nanos));
      position = matcher.end();
    }
    try {
      return Duration.ofNanos(total.setScale(0, RoundingMode.DOWN).longValueExact());
    } catch (final ArithmeticException e) {
      throw new IllegalArgumentException("duration '" + text + "' is out of range", e);
    }
  }
}
