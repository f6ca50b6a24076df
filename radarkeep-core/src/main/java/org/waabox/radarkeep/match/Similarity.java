package org.waabox.radarkeep.match;

import java.util.Objects;

/**
 * Edit-distance based string similarity.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Similarity {

  /** Utility class. */
  private Similarity() {
  }

  /**
   * Computes the Levenshtein distance between two strings.
   *
   * <p>Insertions, deletions and substitutions each cost one. Only two
   * rows of the distance matrix are kept, so memory is linear in the
   * length of the second string.
   *
   * @param a the first string, never null
   * @param b the second string, never null
   *
   * @return the minimum number of single-character edits turning a into b
   */
  public static int editDistance(final String a, final String b) {
    Objects.requireNonNull(a, "a must not be null");
    Objects.requireNonNull(b, "b must not be null");

    int[] previous = new int[b.length() + 1];
    int[] row = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }

    for (int i = 1; i <= a.length(); i++) {
      row[0] = i;
      final char ca = a.charAt(i - 1);
      for (int j = 1; j <= b.length(); j++) {
        if (ca == b.charAt(j - 1)) {
          row[j] = previous[j - 1];
        } else {
          row[j] = 1 + Math.min(previous[j - 1],
              Math.min(previous[j], row[j - 1]));
        }
      }
      final int[] swap = previous;
      previous = row;
      row = swap;
    }
    return previous[b.length()];
  }

  /**
   * Computes the similarity ratio of two strings.
   *
   * <p>The ratio is {@code 1 - distance / max(len(a), len(b))}; two empty
   * strings are fully similar.
   *
   * @param a the first string, never null
   * @param b the second string, never null
   *
   * @return the similarity, within [0, 1]
   */
  public static double ratio(final String a, final String b) {
    final int maxLength = Math.max(a.length(), b.length());
    if (maxLength == 0) {
      return 1.0;
    }
    return 1.0 - (double) editDistance(a, b) / maxLength;
  }
}
