package org.waabox.radarkeep.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * An immutable snapshot of every loaded radar edition.
 *
 * <p>Editions are held most recent first (descending ordinal). Editions
 * sharing an ordinal keep the order in which they were supplied. Lookups
 * scan in this order, so the first exact hit is the most recent one.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RadarCatalog {

  /** The shared empty catalog. */
  private static final RadarCatalog EMPTY =
      new RadarCatalog(Collections.emptyList());

  /** The editions, most recent first, never null. */
  private final List<Edition> editions;

  /** The total number of entries across all editions. */
  private final int entryCount;

  /**
   * Creates a new catalog from already ordered editions.
   *
   * @param orderedEditions the editions, most recent first, never null
   */
  private RadarCatalog(final List<Edition> orderedEditions) {
    editions = Collections.unmodifiableList(orderedEditions);
    entryCount = orderedEditions.stream()
        .mapToInt(edition -> edition.entries().size())
        .sum();
  }

  /**
   * Creates a catalog from the given editions, ordering them by
   * descending ordinal.
   *
   * @param editions the editions in any order, never null
   *
   * @return the catalog, never null
   *
   * @throws NullPointerException if editions or any of its elements is null
   */
  public static RadarCatalog of(final List<Edition> editions) {
    Objects.requireNonNull(editions, "editions must not be null");
    final List<Edition> ordered = new ArrayList<>(editions.size());
    for (final Edition edition : editions) {
      ordered.add(Objects.requireNonNull(edition,
          "editions must not contain null"));
    }
    ordered.sort(Comparator.comparingInt(Edition::ordinal).reversed());
    return new RadarCatalog(ordered);
  }

  /**
   * Returns the catalog with no editions.
   *
   * @return the empty catalog, never null
   */
  public static RadarCatalog empty() {
    return EMPTY;
  }

  /**
   * Returns the editions, most recent first.
   *
   * @return an unmodifiable list of editions, never null
   */
  public List<Edition> editions() {
    return editions;
  }

  /**
   * Returns the total number of entries across all editions.
   *
   * @return the entry count
   */
  public int entryCount() {
    return entryCount;
  }

  /**
   * Returns whether this catalog has no entries at all.
   *
   * @return {@code true} if there is nothing to match against
   */
  public boolean isEmpty() {
    return entryCount == 0;
  }
}
