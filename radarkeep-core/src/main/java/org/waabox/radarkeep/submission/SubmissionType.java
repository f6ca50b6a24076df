package org.waabox.radarkeep.submission;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a submission proposes, as decided by the prior-radar lookup.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SubmissionType {

  /** The blip was never on a radar. */
  NEW,

  /** The blip was on a radar and is proposed again in the same ring. */
  REBLIP,

  /** The blip was on a radar and is proposed for another ring. */
  MOVE,

  /** The blip was on a radar and its write-up changes. */
  UPDATE;

  /**
   * Returns the lowercase wire label of this type.
   *
   * @return the label, never null
   */
  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a submission type from its wire label, ignoring case.
   *
   * @param value the label, never null
   *
   * @return the type, never null
   *
   * @throws IllegalArgumentException if the label is unknown
   */
  @JsonCreator
  public static SubmissionType fromLabel(final String value) {
    Objects.requireNonNull(value, "value must not be null");
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
