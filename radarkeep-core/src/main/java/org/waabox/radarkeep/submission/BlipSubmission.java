package org.waabox.radarkeep.submission;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.waabox.radarkeep.catalog.Quadrant;
import org.waabox.radarkeep.catalog.Ring;

/**
 * A technology radar blip submission, the record kept by the submission
 * store.
 *
 * <p>Submissions arrive already validated; this type only rejects missing
 * required fields. Optional fields are null when absent and are left out
 * of the stored JSON.
 *
 * @param id                  the unique identifier, never null
 * @param name                the technology name, never null
 * @param quadrant            the proposed quadrant, never null
 * @param ring                the proposed ring, never null
 * @param description         the proposed write-up, never null
 * @param clientExamples      client references, may be null
 * @param cautionReasoning    why to hold, may be null
 * @param submissionType      what the submission proposes, never null
 * @param priorRadarReference the prior entry it refers to, may be null
 * @param suggestedNewRing    the target ring of a move, may be null
 * @param createdAt           when the submission was made, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlipSubmission(String id, String name, Quadrant quadrant,
    Ring ring, String description, List<String> clientExamples,
    String cautionReasoning, SubmissionType submissionType,
    PriorRadarReference priorRadarReference, Ring suggestedNewRing,
    Instant createdAt) {

  /**
   * Creates a new BlipSubmission.
   *
   * @throws NullPointerException if a required component is null
   */
  public BlipSubmission {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(quadrant, "quadrant must not be null");
    Objects.requireNonNull(ring, "ring must not be null");
    Objects.requireNonNull(description, "description must not be null");
    Objects.requireNonNull(submissionType, "submissionType must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    if (clientExamples != null) {
      clientExamples = List.copyOf(clientExamples);
    }
  }

  /**
   * Creates a submission of a technology that was never on a radar, with
   * a random id and the current time.
   *
   * @param name        the technology name, never null
   * @param quadrant    the proposed quadrant, never null
   * @param ring        the proposed ring, never null
   * @param description the proposed write-up, never null
   *
   * @return the submission, never null
   */
  public static BlipSubmission newBlip(final String name,
      final Quadrant quadrant, final Ring ring, final String description) {
    return new BlipSubmission(UUID.randomUUID().toString(), name, quadrant,
        ring, description, null, null, SubmissionType.NEW, null, null,
        Instant.now());
  }
}
