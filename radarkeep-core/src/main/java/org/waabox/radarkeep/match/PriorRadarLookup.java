package org.waabox.radarkeep.match;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.radarkeep.catalog.CatalogProvider;
import org.waabox.radarkeep.catalog.RadarCatalog;
import org.waabox.radarkeep.metrics.NoopRadarKeepMetrics;
import org.waabox.radarkeep.metrics.RadarKeepMetrics;

/**
 * The prior-radar lookup used by the submission flow.
 *
 * <p>Takes the current snapshot from a {@link CatalogProvider} and runs
 * the {@link CatalogMatcher} against it. "No match" is an ordinary
 * outcome, never an error, and so is a catalog that could not be loaded.
 *
 * <p>Usage example:
 * <pre>{@code
 * PriorRadarLookup lookup = new PriorRadarLookup(
 *     CatalogProvider.of(new JsonCatalogLoader(Path.of("data/radar")),
 *         CatalogPolicy.LOAD_ONCE),
 *     CatalogMatcher.withDefaults());
 *
 * lookup.lookup("React.js").ifPresent(match ->
 *     show(match.entry().name(), match.editionLabel()));
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PriorRadarLookup {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PriorRadarLookup.class);

  /** The source of catalog snapshots, never null. */
  private final CatalogProvider provider;

  /** The matcher, never null. */
  private final CatalogMatcher matcher;

  /** The metrics reporter, never null. */
  private final RadarKeepMetrics metrics;

  /**
   * Creates a new lookup that reports no metrics.
   *
   * @param theProvider the catalog provider, never null
   * @param theMatcher  the matcher, never null
   */
  public PriorRadarLookup(final CatalogProvider theProvider,
      final CatalogMatcher theMatcher) {
    this(theProvider, theMatcher, new NoopRadarKeepMetrics());
  }

  /**
   * Creates a new lookup.
   *
   * @param theProvider the catalog provider, never null
   * @param theMatcher  the matcher, never null
   * @param theMetrics  the metrics reporter, never null
   *
   * @throws NullPointerException if any argument is null
   */
  public PriorRadarLookup(final CatalogProvider theProvider,
      final CatalogMatcher theMatcher, final RadarKeepMetrics theMetrics) {
    provider = Objects.requireNonNull(theProvider,
        "provider must not be null");
    matcher = Objects.requireNonNull(theMatcher, "matcher must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Looks up the best prior-radar match for the given name.
   *
   * @param name the free-text technology name, never null
   *
   * @return the match, or empty if there is none
   *
   * @throws NullPointerException if name is null
   */
  public Optional<MatchResult> lookup(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    if (name.isBlank()) {
      return Optional.empty();
    }

    final long start = System.nanoTime();
    final RadarCatalog catalog = provider.current();
    final Optional<MatchResult> result = matcher.match(catalog, name);
    metrics.lookupExecuted(result.isPresent(), System.nanoTime() - start);

    if (log.isDebugEnabled()) {
      log.debug("Prior radar lookup for '{}': {}", name, result
          .map(match -> match.entry().name() + " in " + match.editionLabel()
              + " (" + match.similarity() + ")")
          .orElse("no match"));
    }
    return result;
  }

  /**
   * Returns whether any prior-radar data is available to match against.
   *
   * @return {@code true} if the current catalog has at least one entry
   */
  public boolean isCatalogAvailable() {
    return !provider.current().isEmpty();
  }
}
