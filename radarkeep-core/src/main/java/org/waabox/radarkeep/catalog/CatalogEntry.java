package org.waabox.radarkeep.catalog;

import java.util.Objects;

/**
 * One blip of a historical radar edition.
 *
 * <p>Entries are immutable once loaded. The edition label travels with the
 * entry so a match can be displayed without going back to its edition.
 *
 * @param name         the blip name as published, never null
 * @param ring         the ring the blip was placed in, never null
 * @param quadrant     the quadrant the blip was placed in, never null
 * @param description  the published write-up, never null, may be empty
 * @param editionLabel the label of the edition this entry belongs to,
 *                     never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogEntry(String name, Ring ring, Quadrant quadrant,
    String description, String editionLabel) {

  /**
   * Creates a new CatalogEntry.
   *
   * @throws NullPointerException if any component is null
   */
  public CatalogEntry {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(ring, "ring must not be null");
    Objects.requireNonNull(quadrant, "quadrant must not be null");
    Objects.requireNonNull(description, "description must not be null");
    Objects.requireNonNull(editionLabel, "editionLabel must not be null");
  }
}
