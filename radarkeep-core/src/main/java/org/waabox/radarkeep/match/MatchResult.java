package org.waabox.radarkeep.match;

import java.util.Objects;

import org.waabox.radarkeep.catalog.CatalogEntry;

/**
 * The best prior-radar entry found for a query.
 *
 * @param entry      the matched entry, never null
 * @param similarity the similarity of the query to the entry name, in
 *                   [0, 1]; 1.0 for an exact match
 * @param exact      whether the normalized names were equal
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MatchResult(CatalogEntry entry, double similarity,
    boolean exact) {

  /**
   * Creates a new MatchResult.
   *
   * @throws NullPointerException if entry is null
   */
  public MatchResult {
    Objects.requireNonNull(entry, "entry must not be null");
  }

  /**
   * Returns the label of the edition the match comes from, for display.
   *
   * @return the edition label, never null
   */
  public String editionLabel() {
    return entry.editionLabel();
  }
}
