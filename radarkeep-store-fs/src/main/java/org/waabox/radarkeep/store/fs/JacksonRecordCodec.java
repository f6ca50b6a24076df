package org.waabox.radarkeep.store.fs;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.waabox.radarkeep.store.RecordCodec;
import org.waabox.radarkeep.store.RecordSerializationException;

/** Jackson-based {@link RecordCodec} storing the collection as a JSON
 * array.
 *
 * <p>The default mapper pretty-prints, writes {@code java.time} values as
 * ISO-8601 strings through the {@link JavaTimeModule}, and ignores
 * properties it does not know, so that an older build can still read a
 * file written by a newer one.
 *
 * <p>Appending works on the JSON tree: stored elements are never bound to
 * the record type, so their unknown properties and decimal literals are
 * written back as they were read.
 *
 * @param <T> the type of records this codec handles
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JacksonRecordCodec<T> implements RecordCodec<T> {

  /** The Jackson object mapper, never null. */
  private final ObjectMapper mapper;

  /** The {@code List<T>} type, never null. */
  private final JavaType listType;

  /** Creates a new JacksonRecordCodec with a pre-configured
   * {@link ObjectMapper}.
   *
   * @param type the record class, never null
   */
  public JacksonRecordCodec(final Class<T> type) {
    this(defaultMapper(), type);
  }

  /** Creates a new JacksonRecordCodec with the given mapper.
   *
   * @param theMapper the object mapper to use, never null
   * @param type the record class, never null
   */
  public JacksonRecordCodec(final ObjectMapper theMapper,
      final Class<T> type) {
    mapper = Objects.requireNonNull(theMapper, "mapper cannot be null");
    Objects.requireNonNull(type, "type cannot be null");
    listType = mapper.getTypeFactory().constructCollectionType(List.class,
        type);
  }

  /** Encodes the records as a JSON array.
   *
   * @param records the records to encode, never null
   * @return the JSON bytes, never null
   * @throws RecordSerializationException if a record cannot be encoded
   */
  @Override
  public byte[] encode(final List<T> records) {
    Objects.requireNonNull(records, "records cannot be null");
    try {
      return mapper.writerFor(listType).writeValueAsBytes(records);
    } catch (final JsonProcessingException e) {
      throw new RecordSerializationException("Failed to encode records", e);
    }
  }

  /** Adds the record as the last element of the stored JSON array.
   *
   * @param data the stored JSON array, never null
   * @param record the record to add, never null
   * @return the JSON bytes of the extended array, never null
   * @throws RecordSerializationException if data is not a JSON array or
   * the record cannot be encoded
   */
  @Override
  public byte[] append(final byte[] data, final T record) {
    Objects.requireNonNull(record, "record cannot be null");
    final ArrayNode array = readArray(data);
    try {
      array.add(mapper.<JsonNode>valueToTree(record));
      return mapper.writeValueAsBytes(array);
    } catch (final IllegalArgumentException | JsonProcessingException e) {
      throw new RecordSerializationException("Failed to encode record", e);
    }
  }

  /** Counts the elements of the stored JSON array.
   *
   * @param data the stored JSON array, never null
   * @return the number of elements
   * @throws RecordSerializationException if data is not a JSON array
   */
  @Override
  public int count(final byte[] data) {
    return readArray(data).size();
  }

  /** Decodes a JSON array into records.
   *
   * @param data the bytes to decode, never null
   * @return the decoded records, never null
   * @throws RecordSerializationException if the bytes are not a JSON
   * array, or an element does not map to the record type
   */
  @Override
  public List<T> decode(final byte[] data) {
    final ArrayNode array = readArray(data);
    try {
      return mapper.readerFor(listType).readValue(array);
    } catch (final IOException e) {
      throw new RecordSerializationException(
          "Stored elements do not map to " + listType.getContentType(), e);
    }
  }

  /** Parses the bytes as a JSON array, without binding its elements.
   *
   * @param data the bytes to parse, never null
   * @return the array, never null
   * @throws RecordSerializationException if the bytes are not valid JSON
   * or the top level is not an array
   */
  private ArrayNode readArray(final byte[] data) {
    Objects.requireNonNull(data, "data cannot be null");
    final JsonNode tree;
    try {
      tree = mapper.readTree(data);
    } catch (final IOException e) {
      throw new RecordSerializationException(
          "Stored collection is not valid JSON", e);
    }
    if (tree == null || !tree.isArray()) {
      throw new RecordSerializationException(
          "Stored collection is not a JSON array");
    }
    return (ArrayNode) tree;
  }

  /** Builds the mapper used when none is supplied.
   *
   * @return a new object mapper, never null
   */
  private static ObjectMapper defaultMapper() {
    final ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES,
        false);
    return mapper;
  }
}
