package org.waabox.radarkeep.submission;

import java.util.Objects;

import org.waabox.radarkeep.catalog.CatalogEntry;
import org.waabox.radarkeep.catalog.Quadrant;
import org.waabox.radarkeep.catalog.Ring;
import org.waabox.radarkeep.match.MatchResult;

/**
 * The prior-radar entry a submission refers to, copied into the
 * submission so it stays meaningful if the catalog changes.
 *
 * @param name        the published blip name, never null
 * @param ring        the published ring, never null
 * @param quadrant    the published quadrant, never null
 * @param description the published write-up, never null
 * @param volume      the edition label, e.g. "Volume 33 (Nov 2025)",
 *                    never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PriorRadarReference(String name, Ring ring, Quadrant quadrant,
    String description, String volume) {

  /**
   * Creates a new PriorRadarReference.
   *
   * @throws NullPointerException if any component is null
   */
  public PriorRadarReference {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(ring, "ring must not be null");
    Objects.requireNonNull(quadrant, "quadrant must not be null");
    Objects.requireNonNull(description, "description must not be null");
    Objects.requireNonNull(volume, "volume must not be null");
  }

  /**
   * Copies the matched entry of a lookup.
   *
   * @param match the lookup result, never null
   *
   * @return the reference, never null
   */
  public static PriorRadarReference from(final MatchResult match) {
    Objects.requireNonNull(match, "match must not be null");
    final CatalogEntry entry = match.entry();
    return new PriorRadarReference(entry.name(), entry.ring(),
        entry.quadrant(), entry.description(), entry.editionLabel());
  }
}
