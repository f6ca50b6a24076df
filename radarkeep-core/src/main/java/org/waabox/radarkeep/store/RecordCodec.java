package org.waabox.radarkeep.store;

import java.util.List;

/**
 * A strategy for encoding and decoding the whole record collection to and
 * from bytes.
 *
 * <p>Implementations define the wire format (e.g. JSON) of the persisted
 * collection. The top-level container is always a sequence of records.
 *
 * <p>Only {@link #decode(byte[])} binds stored elements to the record
 * type. {@link #count(byte[])} and {@link #append(byte[], Object)} work on
 * the container alone, so an element the record type cannot represent is
 * kept as it was written.
 *
 * @param <T> the type of records this codec handles
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RecordCodec<T> {

  /**
   * Encodes a list of records into a new collection.
   *
   * @param records the records to encode, never null
   *
   * @return the encoded bytes, never null
   *
   * @throws RecordSerializationException if a record cannot be encoded
   */
  byte[] encode(List<T> records);

  /**
   * Adds a record to the end of an encoded collection.
   *
   * <p>The elements already in the collection are carried over unchanged,
   * including any content the record type does not know about.
   *
   * @param data   the encoded collection, never null
   * @param record the record to add, never null
   *
   * @return the encoded collection with the record appended, never null
   *
   * @throws RecordSerializationException if data is not a well-formed
   *                                      collection or the record cannot
   *                                      be encoded
   */
  byte[] append(byte[] data, T record);

  /**
   * Counts the elements of an encoded collection without binding them.
   *
   * @param data the encoded collection, never null
   *
   * @return the number of elements, zero or more
   *
   * @throws RecordSerializationException if data is not a well-formed
   *                                      collection
   */
  int count(byte[] data);

  /**
   * Decodes an encoded collection into records.
   *
   * @param data the bytes to decode, never null
   *
   * @return the decoded records, never null
   *
   * @throws RecordSerializationException if the bytes are not a
   *                                      well-formed collection or an
   *                                      element does not map to the
   *                                      record type
   */
  List<T> decode(byte[] data);
}
