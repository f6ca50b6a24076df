package org.waabox.radarkeep.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link LockPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LockPolicyTest {

  @Test
  void whenCreating_givenValidParams_shouldRetainValues() {
    final LockPolicy policy =
        LockPolicy.of(Duration.ofMillis(20), Duration.ofSeconds(1));

    assertEquals(Duration.ofMillis(20), policy.retryDelay());
    assertEquals(Duration.ofSeconds(1), policy.timeout());
  }

  @Test
  void whenUsingDefault_shouldRetryEvery100msForFiveSeconds() {
    final LockPolicy policy = LockPolicy.defaultPolicy();

    assertEquals(Duration.ofMillis(100), policy.retryDelay());
    assertEquals(Duration.ofSeconds(5), policy.timeout());
  }

  @Test
  void whenCreating_givenNonPositiveDurations_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        LockPolicy.of(Duration.ZERO, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class, () ->
        LockPolicy.of(Duration.ofMillis(10), Duration.ofSeconds(-1)));
  }

  @Test
  void whenCreating_givenDelayLongerThanTimeout_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        LockPolicy.of(Duration.ofSeconds(2), Duration.ofSeconds(1)));
  }

  @Test
  void whenCreating_givenNullDurations_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        LockPolicy.of(null, Duration.ofSeconds(1)));
    assertThrows(NullPointerException.class, () ->
        LockPolicy.of(Duration.ofMillis(10), null));
  }
}
