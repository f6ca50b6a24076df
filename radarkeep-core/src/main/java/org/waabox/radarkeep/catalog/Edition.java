package org.waabox.radarkeep.catalog;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One published radar edition with its entries in file order.
 *
 * @param label   the human readable label, e.g. "Volume 33 (Nov 2025)",
 *                never null
 * @param ordinal the recency ordinal extracted from the label, higher is
 *                more recent
 * @param entries the entries in file order, never null, unmodifiable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Edition(String label, int ordinal, List<CatalogEntry> entries) {

  /** The first run of digits in a label. */
  private static final Pattern FIRST_INTEGER = Pattern.compile("\\d+");

  /**
   * Creates a new Edition.
   *
   * @throws NullPointerException if label or entries is null
   */
  public Edition {
    Objects.requireNonNull(label, "label must not be null");
    Objects.requireNonNull(entries, "entries must not be null");
    entries = List.copyOf(entries);
  }

  /**
   * Creates an edition whose ordinal is derived from its label.
   *
   * @param label   the edition label, never null
   * @param entries the entries in file order, never null
   *
   * @return the edition, never null
   */
  public static Edition of(final String label,
      final List<CatalogEntry> entries) {
    return new Edition(label, ordinalOf(label), entries);
  }

  /**
   * Extracts the first integer found in the given label.
   *
   * <p>"Volume 33 (Nov 2025)" yields 33. A label without digits, or with
   * a number too large for an int, yields 0 so it sorts as the oldest.
   *
   * @param label the label to inspect, never null
   *
   * @return the ordinal, zero or positive
   */
  public static int ordinalOf(final String label) {
    Objects.requireNonNull(label, "label must not be null");
    final Matcher matcher = FIRST_INTEGER.matcher(label);
    if (!matcher.find()) {
      return 0;
    }
    try {
      return Integer.parseInt(matcher.group());
    } catch (final NumberFormatException e) {
      return 0;
    }
  }
}
