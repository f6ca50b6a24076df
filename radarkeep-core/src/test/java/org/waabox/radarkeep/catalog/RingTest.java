package org.waabox.radarkeep.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Ring}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RingTest {

  @Test
  void whenParsing_givenDisplayCase_shouldIgnoreCase() {
    assertEquals(Ring.ADOPT, Ring.fromLabel("Adopt"));
    assertEquals(Ring.TRIAL, Ring.fromLabel(" TRIAL "));
    assertEquals(Ring.ASSESS, Ring.fromLabel("assess"));
    assertEquals(Ring.HOLD, Ring.fromLabel("Hold"));
  }

  @Test
  void whenParsing_givenCaution_shouldReadAsHold() {
    assertEquals(Ring.HOLD, Ring.fromLabel("caution"));
    assertEquals(Ring.HOLD, Ring.fromLabel("Caution"));
  }

  @Test
  void whenWriting_givenHold_shouldUseSubmissionLabel() {
    assertEquals("caution", Ring.HOLD.label());
    assertEquals(Ring.HOLD, Ring.fromLabel(Ring.HOLD.label()));
  }

  @Test
  void whenParsing_givenUnknownLabel_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> Ring.fromLabel("maybe"));
  }
}
