package org.waabox.radarkeep.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.waabox.radarkeep.catalog.CatalogEntry;
import org.waabox.radarkeep.catalog.Edition;
import org.waabox.radarkeep.catalog.Quadrant;
import org.waabox.radarkeep.catalog.RadarCatalog;
import org.waabox.radarkeep.catalog.Ring;

/**
 * Tests for {@link CatalogMatcher}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CatalogMatcherTest {

  private final CatalogMatcher matcher = CatalogMatcher.withDefaults();

  private static Edition edition(final String label, final Ring ring,
      final String... names) {
    return Edition.of(label, Arrays.stream(names)
        .map(name -> new CatalogEntry(name, ring,
            Quadrant.LANGUAGES_AND_FRAMEWORKS, name + " write-up", label))
        .toList());
  }

  private static RadarCatalog catalog(final Edition... editions) {
    return RadarCatalog.of(List.of(editions));
  }

  @Test
  void whenMatching_givenCaseAndPunctuationVariants_shouldMatchExactly() {
    final RadarCatalog catalog = catalog(
        edition("Volume 33 (Nov 2025)", Ring.ADOPT, "Vue", "React", "Svelte"));

    for (final String query : List.of("React", "react", " REACT ", "React!")) {
      final Optional<MatchResult> result = matcher.match(catalog, query);

      assertTrue(result.isPresent(), "No match for '" + query + "'");
      assertEquals("React", result.get().entry().name());
      assertEquals(1.0, result.get().similarity());
      assertTrue(result.get().exact());
    }
  }

  @Test
  void whenMatching_givenSuffixedVariants_shouldResolveSameEntry() {
    final RadarCatalog catalog = catalog(
        edition("Volume 33 (Nov 2025)", Ring.ADOPT, "React"));

    final CatalogEntry react = matcher.match(catalog, "React")
        .orElseThrow().entry();

    assertSame(react, matcher.match(catalog, "React.js")
        .orElseThrow().entry());
    assertSame(react, matcher.match(catalog, "ReactJS")
        .orElseThrow().entry());
  }

  @Test
  void whenMatching_givenShortNameCloseToLongerOne_shouldNotMatch() {
    final RadarCatalog catalog = catalog(
        edition("Volume 33 (Nov 2025)", Ring.TRIAL, "Google", "Gorilla"));

    assertFalse(matcher.match(catalog, "Go").isPresent());
  }

  @Test
  void whenMatching_givenSameNameInTwoEditions_shouldReturnMostRecent() {
    final RadarCatalog catalog = catalog(
        edition("Volume 30 (Apr 2024)", Ring.TRIAL, "Kotlin"),
        edition("Volume 33 (Nov 2025)", Ring.ADOPT, "Kotlin"));

    final MatchResult result = matcher.match(catalog, "kotlin").orElseThrow();

    assertEquals("Volume 33 (Nov 2025)", result.editionLabel());
    assertEquals(Ring.ADOPT, result.entry().ring());
  }

  @Test
  void whenMatching_givenOlderExactAndNewerNearDuplicate_shouldPreferExact() {
    final RadarCatalog catalog = catalog(
        edition("Volume 33 (Nov 2025)", Ring.ADOPT, "Reacts"),
        edition("Volume 20 (Apr 2019)", Ring.TRIAL, "React"));

    final MatchResult result = matcher.match(catalog, "React").orElseThrow();

    assertEquals("React", result.entry().name());
    assertEquals("Volume 20 (Apr 2019)", result.editionLabel());
    assertTrue(result.exact());
  }

  @Test
  void whenMatching_givenTypo_shouldReturnApproximateMatch() {
    final RadarCatalog catalog = catalog(
        edition("Volume 33 (Nov 2025)", Ring.ADOPT, "Kubernetes", "Kafka"));

    final MatchResult result =
        matcher.match(catalog, "Kubernets").orElseThrow();

    assertEquals("Kubernetes", result.entry().name());
    assertEquals(0.9, result.similarity(), 1e-9);
    assertFalse(result.exact());
  }

  @Test
  void whenMatching_givenEqualSimilarityCandidates_shouldKeepFirstSeen() {
    final RadarCatalog catalog = catalog(
        edition("Volume 20 (Apr 2019)", Ring.HOLD, "Terraforx"),
        edition("Volume 33 (Nov 2025)", Ring.ADOPT, "Terraforq", "Terraform"));

    final MatchResult result =
        matcher.match(catalog, "Terraforn").orElseThrow();

    assertEquals("Terraforq", result.entry().name());
    assertEquals("Volume 33 (Nov 2025)", result.editionLabel());
  }

  @Test
  void whenMatching_givenSimilarityBelowThreshold_shouldNotMatch() {
    final RadarCatalog catalog = catalog(
        edition("Volume 33 (Nov 2025)", Ring.ADOPT, "Terraforms"));

    assertFalse(matcher.match(catalog, "Terraforn").isPresent());

    final CatalogMatcher lenient = new CatalogMatcher(
        MatcherSettings.of(0.8, MatcherSettings.DEFAULT_SUFFIXES));
    assertEquals("Terraforms",
        lenient.match(catalog, "Terraforn").orElseThrow().entry().name());
  }

  @Test
  void whenMatching_givenBlankQuery_shouldReturnEmpty() {
    final RadarCatalog catalog = catalog(
        edition("Volume 33 (Nov 2025)", Ring.ADOPT, "React"));

    assertFalse(matcher.match(catalog, "").isPresent());
    assertFalse(matcher.match(catalog, "   \t").isPresent());
  }

  @Test
  void whenMatching_givenEmptyCatalog_shouldReturnEmpty() {
    assertFalse(matcher.match(RadarCatalog.empty(), "React").isPresent());
  }

  @Test
  void whenMatching_givenPathologicalInput_shouldNotThrow() {
    final RadarCatalog catalog = catalog(
        edition("Volume 33 (Nov 2025)", Ring.ADOPT, "React", "Kafka"));

    assertFalse(matcher.match(catalog, "r".repeat(10_000)).isPresent());
    assertFalse(matcher.match(catalog, "\u0000\uFFFF!?").isPresent());
  }

  @Test
  void whenMatching_givenNullArguments_shouldThrow() {
    assertThrows(NullPointerException.class,
        () -> matcher.match(null, "React"));
    assertThrows(NullPointerException.class,
        () -> matcher.match(RadarCatalog.empty(), null));
  }
}
