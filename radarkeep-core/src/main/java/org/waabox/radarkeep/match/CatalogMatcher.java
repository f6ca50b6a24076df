package org.waabox.radarkeep.match;

import java.util.Objects;
import java.util.Optional;

import org.waabox.radarkeep.catalog.CatalogEntry;
import org.waabox.radarkeep.catalog.Edition;
import org.waabox.radarkeep.catalog.RadarCatalog;

/**
 * Finds the prior-radar entry that best matches a free-text technology
 * name.
 *
 * <p>Editions are scanned most recent first and entries in file order.
 * An exact match of the normalized names ends the scan at once, so the
 * most recent exact match always wins over any near-duplicate. Without
 * an exact match the entry with the highest similarity is kept, the
 * first one encountered winning ties, and accepted only if it reaches
 * the configured threshold.
 *
 * <p>The matcher holds no catalog state: the snapshot is passed in on
 * every call. This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogMatcher {

  /** The matcher settings, never null. */
  private final MatcherSettings settings;

  /** The normalizer built from the settings, never null. */
  private final NameNormalizer normalizer;

  /**
   * Creates a new CatalogMatcher.
   *
   * @param theSettings the matcher settings, never null
   *
   * @throws NullPointerException if theSettings is null
   */
  public CatalogMatcher(final MatcherSettings theSettings) {
    settings = Objects.requireNonNull(theSettings,
        "settings must not be null");
    normalizer = new NameNormalizer(theSettings.suffixes());
  }

  /**
   * Creates a matcher with {@link MatcherSettings#defaults()}.
   *
   * @return the matcher, never null
   */
  public static CatalogMatcher withDefaults() {
    return new CatalogMatcher(MatcherSettings.defaults());
  }

  /**
   * Finds the best match for the query in the given catalog.
   *
   * @param catalog the snapshot to search, never null
   * @param query   the free-text name, never null
   *
   * @return the best match, or empty if the query is blank or nothing
   *         reaches the threshold
   *
   * @throws NullPointerException if catalog or query is null
   */
  public Optional<MatchResult> match(final RadarCatalog catalog,
      final String query) {
    Objects.requireNonNull(catalog, "catalog must not be null");
    Objects.requireNonNull(query, "query must not be null");

    if (query.isBlank()) {
      return Optional.empty();
    }
    final String key = normalizer.normalize(query);

    CatalogEntry best = null;
    double bestSimilarity = -1.0;

    for (final Edition edition : catalog.editions()) {
      for (final CatalogEntry entry : edition.entries()) {
        final String candidate = normalizer.normalize(entry.name());
        if (key.equals(candidate)) {
          return Optional.of(new MatchResult(entry, 1.0, true));
        }
        final double similarity = Similarity.ratio(key, candidate);
        if (similarity > bestSimilarity) {
          best = entry;
          bestSimilarity = similarity;
        }
      }
    }

    if (best == null || bestSimilarity < settings.threshold()) {
      return Optional.empty();
    }
    return Optional.of(new MatchResult(best, bestSimilarity, false));
  }

  /**
   * Returns the settings of this matcher.
   *
   * @return the settings, never null
   */
  public MatcherSettings settings() {
    return settings;
  }
}
