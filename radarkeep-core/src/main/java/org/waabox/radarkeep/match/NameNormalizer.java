package org.waabox.radarkeep.match;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns a technology name into its comparison key.
 *
 * <p>The key is lowercase, has at most one well-known suffix removed,
 * keeps only letters, digits and single spaces, and is trimmed. It is used
 * for comparison only and never shown to a user.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NameNormalizer {

  /** Everything that is neither a letter, a digit nor whitespace. */
  private static final Pattern PUNCTUATION =
      Pattern.compile("[^\\p{L}\\p{N}\\s]");

  /** A run of whitespace. */
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** The lowercase suffixes, tried in order. */
  private final List<String> suffixes;

  /**
   * Creates a normalizer stripping the given suffixes.
   *
   * @param theSuffixes the lowercase suffixes, tried in order, never null
   */
  public NameNormalizer(final List<String> theSuffixes) {
    suffixes = List.copyOf(Objects.requireNonNull(theSuffixes,
        "suffixes must not be null"));
  }

  /**
   * Normalizes the given name.
   *
   * <p>"React.js", "ReactJS", " REACT " and "React!" all normalize to
   * "react".
   *
   * @param name the name to normalize, never null
   *
   * @return the comparison key, never null, may be empty
   */
  public String normalize(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    String key = stripSuffix(name.toLowerCase(Locale.ROOT).trim());
    key = PUNCTUATION.matcher(key).replaceAll("");
    key = WHITESPACE.matcher(key).replaceAll(" ");
    return key.trim();
  }

  /**
   * Removes the first configured suffix the value ends with, unless that
   * would leave nothing but whitespace behind.
   *
   * @param value the lowercase, trimmed value, never null
   *
   * @return the value without its suffix, never null
   */
  private String stripSuffix(final String value) {
    for (final String suffix : suffixes) {
      if (value.endsWith(suffix)) {
        final String stripped =
            value.substring(0, value.length() - suffix.length());
        return stripped.isBlank() ? value : stripped;
      }
    }
    return value;
  }
}
