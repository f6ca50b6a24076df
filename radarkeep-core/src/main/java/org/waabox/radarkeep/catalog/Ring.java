package org.waabox.radarkeep.catalog;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four radar rings, ordered from the center (most recommended) to the
 * outer edge (least recommended).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Ring {

  /** Proven and recommended for broad use. */
  ADOPT("adopt"),

  /** Worth pursuing on projects that can handle the risk. */
  TRIAL("trial"),

  /** Worth exploring to understand how it will affect you. */
  ASSESS("assess"),

  /** Proceed with caution, written as "caution" in submissions. */
  HOLD("caution");

  /** The wire label, never null. */
  private final String label;

  /**
   * Creates a ring with its wire label.
   *
   * @param theLabel the lowercase label, never null
   */
  Ring(final String theLabel) {
    label = theLabel;
  }

  /**
   * Returns the lowercase wire label of this ring.
   *
   * @return the label, never null
   */
  @JsonValue
  public String label() {
    return label;
  }

  /**
   * Parses a ring from a snapshot or submission label.
   *
   * <p>Matching is case-insensitive and ignores surrounding whitespace.
   * Older radar editions call the outer ring "hold", so that label is
   * read as {@link #HOLD} too.
   *
   * @param value the label to parse, never null
   *
   * @return the ring, never null
   *
   * @throws IllegalArgumentException if the label is not a known ring
   */
  @JsonCreator
  public static Ring fromLabel(final String value) {
    Objects.requireNonNull(value, "value must not be null");
    final String candidate = value.trim().toLowerCase(Locale.ROOT);
    if ("hold".equals(candidate)) {
      return HOLD;
    }
    for (final Ring ring : values()) {
      if (ring.label.equals(candidate)) {
        return ring;
      }
    }
    throw new IllegalArgumentException("Unknown ring: " + value);
  }
}
