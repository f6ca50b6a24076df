package org.waabox.radarkeep.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Similarity}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SimilarityTest {

  @Test
  void whenComputingDistance_givenClassicPairs_shouldCountEdits() {
    assertEquals(3, Similarity.editDistance("kitten", "sitting"));
    assertEquals(3, Similarity.editDistance("", "abc"));
    assertEquals(3, Similarity.editDistance("abc", ""));
    assertEquals(0, Similarity.editDistance("same", "same"));
    assertEquals(1, Similarity.editDistance("kubernets", "kubernetes"));
  }

  @Test
  void whenComputingRatio_givenTwoEmptyStrings_shouldBeFullySimilar() {
    assertEquals(1.0, Similarity.ratio("", ""));
  }

  @Test
  void whenComputingRatio_givenShortDifferentNames_shouldBeLow() {
    assertEquals(1.0 - 4.0 / 6.0, Similarity.ratio("go", "google"), 1e-9);
    assertTrue(Similarity.ratio("go", "google") < 0.85);
  }

  @Test
  void whenComputingRatio_givenOneTypo_shouldScaleWithLength() {
    assertEquals(0.9, Similarity.ratio("kubernets", "kubernetes"), 1e-9);
    assertEquals(0.0, Similarity.ratio("abc", "xyz"), 1e-9);
  }

  @Test
  void whenComputingRatio_givenLongInputs_shouldNotFail() {
    final String longName = "x".repeat(5_000);

    assertEquals(1.0 - 4_999.0 / 5_000.0,
        Similarity.ratio(longName, "x"), 1e-9);
  }
}
