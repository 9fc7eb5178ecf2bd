package com.example.secretsync.core.manifest;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class DurationsTest {

  @Test
  @DisplayName("Should parse single and compound units")
  void shouldParseUnits() {
    assertEquals(Duration.ofSeconds(15), Durations.parse("15s"));
    assertEquals(Duration.ofMillis(250), Durations.parse("250ms"));
    assertEquals(Duration.ofMinutes(90), Durations.parse("1h30m"));
    assertEquals(Duration.ofMinutes(90), Durations.parse("1.5h"));
    assertEquals(Duration.ofMillis(500), Durations.parse(".5s"));
    assertEquals(Duration.ofNanos(1_500), Durations.parse("1us500ns"));
    assertEquals(Duration.ofSeconds(61), Durations.parse(" 1m1s "));
  }

  @Test
  @DisplayName("Should accept a bare zero")
  void shouldAcceptZero() {
    assertEquals(Duration.ZERO, Durations.parse("0"));
  }

  @Test
  @DisplayName("Should reject malformed durations")
  void shouldRejectMalformed() {
    for (final var text : List.of("", "15", "s", "1d", "-5s", "1h 30m", "1.s", "abc")) {
      assertThrows(IllegalArgumentException.class, () -> Durations.parse(text), text);
    }
    assertThrows(IllegalArgumentException.class, () -> Durations.parse(null));
  }

  @Test
  @DisplayName("Should reject durations that overflow")
  void shouldRejectOverflow() {
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("9999999999h"));
  }
}
