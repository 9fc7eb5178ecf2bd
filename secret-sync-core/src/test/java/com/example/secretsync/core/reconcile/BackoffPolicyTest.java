package com.example.secretsync.core.reconcile;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class BackoffPolicyTest {

  @Test
  @DisplayName("Should double from the initial delay up to the cap")
  void shouldGrowExponentially() {
    final var policy = BackoffPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(10));
    assertEquals(Duration.ofSeconds(1), policy.delayFor(0));
    assertEquals(Duration.ofSeconds(1), policy.delayFor(1));
    assertEquals(Duration.ofSeconds(2), policy.delayFor(2));
    assertEquals(Duration.ofSeconds(4), policy.delayFor(3));
    assertEquals(Duration.ofSeconds(8), policy.delayFor(4));
    assertEquals(Duration.ofSeconds(10), policy.delayFor(5));
    assertEquals(Duration.ofSeconds(10), policy.delayFor(500));
  }

  @Test
  @DisplayName("Should default to 5 seconds capped at 5 minutes")
  void shouldUseDefaults() {
    final var policy = BackoffPolicy.defaults();
    assertEquals(Duration.ofSeconds(5), policy.delayFor(1));
    assertEquals(Duration.ofSeconds(10), policy.delayFor(2));
    assertEquals(Duration.ofMinutes(5), policy.delayFor(20));
  }

  @Test
  @DisplayName("Should keep a fixed delay")
  void shouldKeepFixedDelay() {
    final var policy = BackoffPolicy.fixed(Duration.ofMillis(250));
    assertEquals(Duration.ofMillis(250), policy.delayFor(1));
    assertEquals(Duration.ofMillis(250), policy.delayFor(7));
  }

  @Test
  @DisplayName("Should add at most 25% jitter")
  void shouldBoundJitter() {
    final var policy =
        BackoffPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(8)).withJitter();
    for (var i = 0; i < 100; i++) {
      final var delay = policy.delayFor(4).toMillis();
      assertTrue(delay >= 8_000 && delay <= 10_000, "delay " + delay);
    }
  }

  @Test
  @DisplayName("Should reject invalid parameters")
  void shouldRejectInvalidParameters() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1), 2.0, false));
    assertThrows(
        IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0, false));
    assertThrows(
        IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), 0.5, false));
  }
}
