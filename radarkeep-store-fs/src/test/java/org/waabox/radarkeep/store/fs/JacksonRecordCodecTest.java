package org.waabox.radarkeep.store.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.radarkeep.catalog.Quadrant;
import org.waabox.radarkeep.catalog.Ring;
import org.waabox.radarkeep.store.RecordSerializationException;
import org.waabox.radarkeep.submission.BlipSubmission;
import org.waabox.radarkeep.submission.PriorRadarReference;
import org.waabox.radarkeep.submission.SubmissionType;

/**
 * Tests for {@link JacksonRecordCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JacksonRecordCodecTest {

  private final JacksonRecordCodec<BlipSubmission> codec =
      new JacksonRecordCodec<>(BlipSubmission.class);

  private static byte[] utf8(final String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void whenEncoding_givenSubmission_shouldWriteWireLabelsAndSkipNulls() {
    final BlipSubmission move = new BlipSubmission("sub-1", "Kotlin",
        Quadrant.LANGUAGES_AND_FRAMEWORKS, Ring.ADOPT, "Ready for prime time",
        List.of("Client A - payments"), null, SubmissionType.MOVE,
        new PriorRadarReference("Kotlin", Ring.TRIAL,
            Quadrant.LANGUAGES_AND_FRAMEWORKS, "Worth a try",
            "Volume 20 (Apr 2019)"),
        Ring.ADOPT, Instant.parse("2026-01-15T10:30:00Z"));

    final String json = new String(codec.encode(List.of(move)),
        StandardCharsets.UTF_8);

    assertTrue(json.trim().startsWith("["));
    assertTrue(json.contains("\"languages-and-frameworks\""));
    assertTrue(json.contains("\"move\""));
    assertTrue(json.contains("\"2026-01-15T10:30:00Z\""));
    assertFalse(json.contains("cautionReasoning"));

    final BlipSubmission decoded = codec.decode(utf8(json)).get(0);
    assertEquals(move, decoded);
  }

  @Test
  void whenDecoding_givenOriginalWireFormat_shouldReadSubmission() {
    final List<BlipSubmission> decoded = codec.decode(utf8("[{"
        + "\"id\": \"test-1\", \"name\": \"React\","
        + " \"quadrant\": \"languages-and-frameworks\", \"ring\": \"caution\","
        + " \"description\": \"UI library\", \"submissionType\": \"new\","
        + " \"createdAt\": \"2025-11-01T09:00:00.000Z\","
        + " \"source\": \"web-form\"}]"));

    assertEquals(1, decoded.size());
    assertEquals(Ring.HOLD, decoded.get(0).ring());
    assertNull(decoded.get(0).clientExamples());
    assertEquals(SubmissionType.NEW, decoded.get(0).submissionType());
  }

  @Test
  void whenEncoding_givenHoldRing_shouldWriteCaution() {
    final BlipSubmission hold = new BlipSubmission("sub-2",
        "Microservice envy", Quadrant.TECHNIQUES, Ring.HOLD,
        "Too many services",
        null, "Operational overhead", SubmissionType.NEW, null, null,
        Instant.parse("2026-02-01T08:00:00Z"));

    final String json = new String(codec.encode(List.of(hold)),
        StandardCharsets.UTF_8);

    assertTrue(json.contains("\"ring\" : \"caution\""));
    assertFalse(json.contains("\"hold\""));
    assertEquals(Ring.HOLD, codec.decode(utf8(json)).get(0).ring());
  }

  @Test
  void whenAppending_givenStoredUnknownProperties_shouldCarryThemOver() {
    final byte[] stored = utf8("[{\"id\": \"test-1\", \"name\": \"React\","
        + " \"quadrant\": \"tools\", \"ring\": \"adopt\","
        + " \"description\": \"UI library\", \"submissionType\": \"new\","
        + " \"createdAt\": \"2025-11-01T09:00:00Z\","
        + " \"source\": \"web-form\"}]");

    final byte[] updated = codec.append(stored, BlipSubmission.newBlip(
        "Kotlin", Quadrant.LANGUAGES_AND_FRAMEWORKS, Ring.ADOPT, "Solid"));

    final String json = new String(updated, StandardCharsets.UTF_8);
    assertTrue(json.contains("\"source\" : \"web-form\""));
    assertEquals(2, codec.count(updated));
    assertEquals("Kotlin", codec.decode(updated).get(1).name());
  }

  @Test
  void whenAppending_givenUnmappableElement_shouldKeepItAsWritten() {
    final byte[] stored = utf8("[{\"name\": \"No description\","
        + " \"ring\": \"sometimes\"}]");

    final byte[] updated = codec.append(stored, BlipSubmission.newBlip(
        "Kotlin", Quadrant.LANGUAGES_AND_FRAMEWORKS, Ring.ADOPT, "Solid"));

    assertEquals(2, codec.count(updated));
    assertTrue(new String(updated, StandardCharsets.UTF_8)
        .contains("\"ring\" : \"sometimes\""));
    assertThrows(RecordSerializationException.class,
        () -> codec.decode(updated));
  }

  @Test
  void whenAppending_givenMalformedCollection_shouldThrow() {
    assertThrows(RecordSerializationException.class,
        () -> codec.append(utf8("{\"id\": \"x\"}"), BlipSubmission.newBlip(
            "Kotlin", Quadrant.LANGUAGES_AND_FRAMEWORKS, Ring.ADOPT,
            "Solid")));
  }

  @Test
  void whenCounting_givenElementsOfAnyShape_shouldCountWithoutBinding() {
    assertEquals(3, codec.count(utf8("[{}, {\"name\": 1}, \"text\"]")));
    assertEquals(0, codec.count(utf8("[]")));
  }

  @Test
  void whenCounting_givenTrailingContent_shouldThrow() {
    assertThrows(RecordSerializationException.class,
        () -> codec.count(utf8("[] []")));
  }

  @Test
  void whenLoadingJackson_givenManagedVersions_shouldUseOneRelease() {
    assertEquals(com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION,
        com.fasterxml.jackson.core.json.PackageVersion.VERSION);
    assertEquals(com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION,
        com.fasterxml.jackson.datatype.jsr310.PackageVersion.VERSION);
  }

  @Test
  void whenDecoding_givenEmptyArray_shouldReturnEmptyList() {
    assertTrue(codec.decode(utf8("[]")).isEmpty());
  }

  @Test
  void whenDecoding_givenTopLevelObject_shouldThrow() {
    assertThrows(RecordSerializationException.class,
        () -> codec.decode(utf8("{\"id\": \"x\"}")));
  }

  @Test
  void whenDecoding_givenTruncatedJson_shouldThrow() {
    assertThrows(RecordSerializationException.class,
        () -> codec.decode(utf8("[{\"id\": \"test-1\", \"na")));
  }

  @Test
  void whenDecoding_givenNoContent_shouldThrow() {
    assertThrows(RecordSerializationException.class,
        () -> codec.decode(new byte[0]));
  }
}
