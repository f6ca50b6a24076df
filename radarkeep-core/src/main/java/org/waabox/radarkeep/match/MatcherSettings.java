package org.waabox.radarkeep.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Tuning knobs of the {@link CatalogMatcher}.
 *
 * <p>Instances are created through static factory methods. The default
 * settings accept approximate matches at a similarity of 0.85 or more and
 * strip one of {@code .js}, {@code .io}, {@code .net}, {@code .org} or a
 * joined {@code js} from the end of a name.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MatcherSettings {

  /** The default minimum similarity of an approximate match. */
  public static final double DEFAULT_THRESHOLD = 0.85;

  /** The default suffixes, tried in order. */
  public static final List<String> DEFAULT_SUFFIXES =
      List.of(".js", ".io", ".net", ".org", "js");

  /** The minimum similarity an approximate match needs, in [0, 1]. */
  private final double threshold;

  /** The suffixes to strip, lowercase, in the order they are tried. */
  private final List<String> suffixes;

  /**
   * Creates new matcher settings.
   *
   * @param theThreshold the similarity threshold, in [0, 1]
   * @param theSuffixes  the lowercase suffixes, never null
   */
  private MatcherSettings(final double theThreshold,
      final List<String> theSuffixes) {
    threshold = theThreshold;
    suffixes = theSuffixes;
  }

  /**
   * Creates matcher settings with the given parameters.
   *
   * @param threshold the minimum similarity of an approximate match, must
   *                  be within [0, 1]
   * @param suffixes  the suffixes to strip, tried in order, never null;
   *                  blank suffixes are not allowed
   *
   * @return the settings, never null
   *
   * @throws IllegalArgumentException if threshold is outside [0, 1] or a
   *                                  suffix is blank
   * @throws NullPointerException     if suffixes or any suffix is null
   */
  public static MatcherSettings of(final double threshold,
      final List<String> suffixes) {
    if (!(threshold >= 0.0 && threshold <= 1.0)) {
      throw new IllegalArgumentException(
          "threshold must be within [0, 1], got: " + threshold);
    }
    Objects.requireNonNull(suffixes, "suffixes must not be null");
    final List<String> lowered = new ArrayList<>(suffixes.size());
    for (final String suffix : suffixes) {
      Objects.requireNonNull(suffix, "suffixes must not contain null");
      final String candidate = suffix.trim().toLowerCase(Locale.ROOT);
      if (candidate.isEmpty()) {
        throw new IllegalArgumentException("suffixes must not be blank");
      }
      lowered.add(candidate);
    }
    return new MatcherSettings(threshold, List.copyOf(lowered));
  }

  /**
   * Creates matcher settings with the default threshold and suffixes.
   *
   * @return the default settings, never null
   */
  public static MatcherSettings defaults() {
    return new MatcherSettings(DEFAULT_THRESHOLD, DEFAULT_SUFFIXES);
  }

  /**
   * Returns the minimum similarity of an approximate match.
   *
   * @return the threshold, within [0, 1]
   */
  public double threshold() {
    return threshold;
  }

  /**
   * Returns the suffixes to strip, in the order they are tried.
   *
   * @return an unmodifiable list of lowercase suffixes, never null
   */
  public List<String> suffixes() {
    return suffixes;
  }
}
