package org.waabox.radarkeep.store;

import java.util.List;

/**
 * An append-only, insertion-ordered collection of records shared by
 * concurrent writers.
 *
 * <p>There is no update or delete: every record is appended exactly once
 * and is never modified afterwards. Implementations must guarantee that a
 * reader always sees a complete collection, either the one before or the
 * one after any concurrent append, never a partially written one.
 *
 * @param <T> the type of records held by this store
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RecordStore<T> {

  /**
   * Appends a record to the end of the collection.
   *
   * <p>When this method returns normally the record has been committed.
   * When it throws, the write is not guaranteed and the caller should
   * offer a retry.
   *
   * @param record the record to append, never null
   *
   * @throws LockTimeoutException         if exclusive access could not be
   *                                      obtained in time
   * @throws RecordSerializationException if the collection could not be
   *                                      encoded or failed verification
   *                                      after the write
   * @throws RecordStoreException         on any other storage failure
   */
  void append(T record);

  /**
   * Reads the whole collection, in insertion order.
   *
   * <p>Reading never blocks on writers. A missing collection, or one that
   * is not a well-formed record sequence, is read as empty.
   *
   * @return an unmodifiable list of records, never null
   *
   * @throws RecordStoreException if the collection exists but cannot be
   *                              read from the backing storage, or holds
   *                              an element that does not map to the
   *                              record type
   */
  List<T> readAll();

  /**
   * Returns the number of stored records and where they are kept.
   *
   * @return the store statistics, never null
   */
  StoreStats stats();

  /**
   * Checks whether the store can currently accept writes.
   *
   * @return {@code true} if the backing storage is writable
   */
  boolean isAvailable();
}
