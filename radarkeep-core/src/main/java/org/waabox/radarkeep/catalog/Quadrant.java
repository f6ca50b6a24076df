package org.waabox.radarkeep.catalog;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four radar quadrants that classify a blip by its nature.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Quadrant {

  /** Techniques. */
  TECHNIQUES("techniques"),

  /** Tools. */
  TOOLS("tools"),

  /** Platforms. */
  PLATFORMS("platforms"),

  /** Languages and frameworks. */
  LANGUAGES_AND_FRAMEWORKS("languages-and-frameworks");

  /** The wire label, never null. */
  private final String label;

  /**
   * Creates a quadrant with its wire label.
   *
   * @param theLabel the lowercase, hyphenated label, never null
   */
  Quadrant(final String theLabel) {
    label = theLabel;
  }

  /**
   * Returns the lowercase, hyphenated wire label of this quadrant.
   *
   * @return the label, never null
   */
  @JsonValue
  public String label() {
    return label;
  }

  /**
   * Parses a quadrant from a snapshot or submission label.
   *
   * <p>Snapshot files spell quadrants for display ("Languages &amp;
   * Frameworks") while submissions use the hyphenated form. Both parse:
   * the value is case-folded, {@code &} reads as {@code and}, and every
   * run of other non-alphanumeric characters reads as one hyphen.
   *
   * @param value the label to parse, never null
   *
   * @return the quadrant, never null
   *
   * @throws IllegalArgumentException if the label is not a known quadrant
   */
  @JsonCreator
  public static Quadrant fromLabel(final String value) {
    Objects.requireNonNull(value, "value must not be null");
    final String candidate = value.toLowerCase(Locale.ROOT)
        .replace("&", " and ")
        .replaceAll("[^a-z0-9]+", "-")
        .replaceAll("^-|-$", "");
    for (final Quadrant quadrant : values()) {
      if (quadrant.label.equals(candidate)) {
        return quadrant;
      }
    }
    throw new IllegalArgumentException("Unknown quadrant: " + value);
  }
}
