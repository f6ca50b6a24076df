package org.waabox.radarkeep.store.fs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.radarkeep.metrics.NoopRadarKeepMetrics;
import org.waabox.radarkeep.metrics.RadarKeepMetrics;
import org.waabox.radarkeep.store.LockPolicy;
import org.waabox.radarkeep.store.LockTimeoutException;
import org.waabox.radarkeep.store.RecordCodec;
import org.waabox.radarkeep.store.RecordSerializationException;
import org.waabox.radarkeep.store.RecordStore;
import org.waabox.radarkeep.store.RecordStoreException;
import org.waabox.radarkeep.store.StoreStats;
import org.waabox.radarkeep.store.WriteLock;

/**
 * A {@link RecordStore} that keeps the whole collection in a single file
 * on the local filesystem.
 *
 * <p>Every append is a read-modify-write cycle guarded by a
 * {@link LockFile}:
 * <ol>
 *   <li>read the current collection (missing or malformed reads as
 *       empty),</li>
 *   <li>append the record to the collection as stored, without binding the
 *       existing elements, and write the result to a temporary file next
 *       to the primary file,</li>
 *   <li>copy the current primary file to the rolling backup,</li>
 *   <li>atomically rename the temporary file onto the primary file,</li>
 *   <li>read the primary file back and check the record count.</li>
 * </ol>
 *
 * <p>Existing elements are never decoded on the write path, so an element
 * the record type cannot represent survives every later append as it was
 * written. Only {@link #readAll()} binds elements to the record type.
 *
 * <p>Because the primary file is only ever replaced by a rename, readers
 * never take the lock and always see a complete collection, the one
 * before or the one after a concurrent append.
 *
 * <p>Storage layout for a primary file {@code submissions.json}:
 * <pre>
 * submissions.json          the committed collection
 * submissions.json.backup   the collection before the last append
 * submissions.json.lock     present only while an append is running
 * submissions.json.*.tmp    present only while an append is running
 * </pre>
 *
 * <p>Designed for a single host and a handful of concurrent writers.
 *
 * @param <T> the type of records held by this store
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemRecordStore<T> implements RecordStore<T> {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileSystemRecordStore.class);

  /** The environment variable overriding the default primary file. */
  public static final String STORAGE_PATH_ENV = "STORAGE_PATH";

  /** The suffix of the rolling backup file. */
  static final String BACKUP_SUFFIX = ".backup";

  /** The suffix of the lock marker file. */
  static final String LOCK_SUFFIX = ".lock";

  /** The suffix of temporary files. */
  static final String TEMP_SUFFIX = ".tmp";

  /** The primary file, absolute, never null. */
  private final Path path;

  /** The rolling backup file, never null. */
  private final Path backupPath;

  /** The codec for the whole collection, never null. */
  private final RecordCodec<T> codec;

  /** The lock guarding appends, never null. */
  private final WriteLock lock;

  /** The metrics reporter, never null. */
  private final RadarKeepMetrics metrics;

  /**
   * Creates a new FileSystemRecordStore.
   *
   * @param thePath    the absolute primary file, never null
   * @param theCodec   the collection codec, never null
   * @param theLock    the write lock, never null
   * @param theMetrics the metrics reporter, never null
   */
  private FileSystemRecordStore(final Path thePath,
      final RecordCodec<T> theCodec, final WriteLock theLock,
      final RadarKeepMetrics theMetrics) {
    path = thePath;
    backupPath = sibling(thePath, BACKUP_SUFFIX);
    codec = theCodec;
    lock = theLock;
    metrics = theMetrics;
  }

  /**
   * Creates a new builder for a store using the given codec.
   *
   * @param codec the collection codec, never null
   * @param <T>   the type of records held by the store
   *
   * @return a new builder, never null
   *
   * @throws NullPointerException if codec is null
   */
  public static <T> Builder<T> builder(final RecordCodec<T> codec) {
    return new Builder<>(codec);
  }

  /**
   * Returns the conventional primary file: the value of the
   * {@value #STORAGE_PATH_ENV} environment variable when it is set,
   * {@code data/submissions.json} otherwise.
   *
   * @return the default primary file, never null
   */
  public static Path defaultPath() {
    return defaultPath(System.getenv());
  }

  /**
   * Resolves the default primary file from the given environment.
   *
   * @param env the environment variables, never null
   *
   * @return the default primary file, never null
   */
  static Path defaultPath(final Map<String, String> env) {
    final String configured = env.get(STORAGE_PATH_ENV);
    if (configured != null && !configured.isBlank()) {
      return Path.of(configured);
    }
    return Path.of("data", "submissions.json");
  }

  /**
   * {@inheritDoc}
   *
   * <p>The lock is released on every exit path before an exception
   * reaches the caller.
   */
  @Override
  public void append(final T record) {
    Objects.requireNonNull(record, "record must not be null");
    ensureDirectory();

    try {
      lock.acquire();
    } catch (final LockTimeoutException e) {
      metrics.lockTimedOut(path.toString());
      throw e;
    }

    final int expected;
    try {
      final byte[] current = readCollection();
      final byte[] updated;
      if (current == null) {
        expected = 1;
        updated = codec.encode(List.of(record));
      } else {
        expected = codec.count(current) + 1;
        updated = codec.append(current, record);
      }
      commit(updated);
      verify(expected);
    } finally {
      lock.release();
    }

    metrics.recordAppended(path.toString(), expected);
    log.debug("Appended record #{} to {}", expected, path);
  }

  /** {@inheritDoc} */
  @Override
  public List<T> readAll() {
    final byte[] data = readCollection();
    if (data == null) {
      return List.of();
    }
    try {
      return Collections.unmodifiableList(codec.decode(data));
    } catch (final RecordSerializationException e) {
      throw new RecordStoreException("Stored collection " + path
          + " holds records that cannot be read", e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Counts stored elements without decoding them.
   */
  @Override
  public StoreStats stats() {
    final byte[] data = readCollection();
    return new StoreStats(data == null ? 0 : codec.count(data),
        path.toString());
  }

  /**
   * {@inheritDoc}
   *
   * <p>Creates the parent directory if needed and checks that it is
   * writable.
   */
  @Override
  public boolean isAvailable() {
    try {
      Files.createDirectories(path.getParent());
      if (!Files.isWritable(path.getParent())) {
        log.error("Storage not available: {} is not writable",
            path.getParent());
        return false;
      }
      return true;
    } catch (final IOException e) {
      log.error("Storage not available: cannot create {}", path.getParent(),
          e);
      return false;
    }
  }

  /**
   * Returns the primary file of this store.
   *
   * @return the absolute primary file, never null
   */
  public Path path() {
    return path;
  }

  /**
   * Returns the rolling backup file of this store.
   *
   * @return the backup file, never null
   */
  public Path backupPath() {
    return backupPath;
  }

  /**
   * Reads the primary file and checks it is a well-formed collection.
   *
   * @return the stored bytes, or null if the file is missing or is not a
   *         well-formed collection
   *
   * @throws RecordStoreException if the file exists but cannot be read
   */
  private byte[] readCollection() {
    final byte[] data;
    try {
      data = Files.readAllBytes(path);
    } catch (final NoSuchFileException e) {
      return null;
    } catch (final IOException e) {
      throw new RecordStoreException("Failed to read " + path, e);
    }

    try {
      codec.count(data);
      return data;
    } catch (final RecordSerializationException e) {
      log.warn("Stored collection {} is corrupted and is read as empty;"
          + " the previous state may be recovered from {}: {}", path,
          backupPath, e.getMessage());
      metrics.corruptionDetected(path.toString());
      return null;
    }
  }

  /**
   * Writes the encoded collection to a temporary file, backs up the
   * current primary file and renames the temporary file onto it.
   *
   * <p>The temporary file is created with the default file mode and then
   * takes the permissions of the current primary file, if any.
   *
   * @param data the encoded collection, never null
   *
   * @throws RecordStoreException if any filesystem step fails; the
   *                              primary file is then left untouched
   */
  private void commit(final byte[] data) {
    Path temp = null;
    try {
      temp = path.resolveSibling(path.getFileName() + "."
          + UUID.randomUUID() + TEMP_SUFFIX);
      Files.write(temp, data, StandardOpenOption.CREATE_NEW,
          StandardOpenOption.WRITE);

      if (Files.exists(path)) {
        copyPermissions(path, temp);
        Files.copy(path, backupPath, StandardCopyOption.REPLACE_EXISTING);
      }

      Files.move(temp, path,
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
      temp = null;
    } catch (final IOException e) {
      throw new RecordStoreException("Failed to write " + path, e);
    } finally {
      if (temp != null) {
        deleteQuietly(temp);
      }
    }
  }

  /**
   * Reads the primary file back and checks it holds the expected number
   * of records.
   *
   * @param expected the record count after the append
   *
   * @throws RecordSerializationException if the file cannot be decoded or
   *                                      holds another number of records
   */
  private void verify(final int expected) {
    final int written;
    try {
      written = codec.count(Files.readAllBytes(path));
    } catch (final IOException | RecordSerializationException e) {
      log.error("Verification of {} failed after write", path, e);
      throw new RecordSerializationException(
          "Verification failed after write to " + path, e);
    }
    if (written != expected) {
      log.error("Verification of {} failed after write: expected {} records,"
          + " found {}", path, expected, written);
      throw new RecordSerializationException("Verification failed after"
          + " write to " + path + ": expected " + expected
          + " records, found " + written);
    }
  }

  /** Creates the parent directory of the primary file if needed. */
  private void ensureDirectory() {
    try {
      Files.createDirectories(path.getParent());
    } catch (final IOException e) {
      throw new RecordStoreException(
          "Failed to create storage directory " + path.getParent(), e);
    }
  }

  /**
   * Gives the target the POSIX permissions of the source, on file systems
   * that have them.
   *
   * @param source the file to copy permissions from, never null
   * @param target the file to copy permissions to, never null
   *
   * @throws IOException if the permissions cannot be read or set
   */
  private static void copyPermissions(final Path source, final Path target)
      throws IOException {
    if (!Files.getFileStore(target).supportsFileAttributeView(
        PosixFileAttributeView.class)) {
      return;
    }
    Files.setPosixFilePermissions(target,
        Files.getPosixFilePermissions(source));
  }

  /**
   * Deletes a leftover temporary file, logging instead of failing.
   *
   * @param temp the temporary file, never null
   */
  private static void deleteQuietly(final Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (final IOException e) {
      log.warn("Failed to delete temporary file {}", temp, e);
    }
  }

  /**
   * Resolves a file next to the given one, named after it plus a suffix.
   *
   * @param file   the base file, never null
   * @param suffix the suffix to append, never null
   *
   * @return the sibling path, never null
   */
  private static Path sibling(final Path file, final String suffix) {
    return file.resolveSibling(file.getFileName() + suffix);
  }

  /**
   * Fluent builder for {@link FileSystemRecordStore}.
   *
   * <p>Only the codec is required. The primary file defaults to
   * {@link FileSystemRecordStore#defaultPath()}, the lock policy to
   * {@link LockPolicy#defaultPolicy()} and metrics to a no-op reporter.
   *
   * @param <T> the type of records held by the store
   */
  public static final class Builder<T> {

    /** The collection codec. */
    private final RecordCodec<T> codec;

    /** The primary file. */
    private Path path;

    /** The lock policy. */
    private LockPolicy lockPolicy;

    /** The metrics reporter. */
    private RadarKeepMetrics metrics;

    /**
     * Creates a new builder.
     *
     * @param theCodec the collection codec, never null
     */
    private Builder(final RecordCodec<T> theCodec) {
      codec = Objects.requireNonNull(theCodec, "codec must not be null");
    }

    /**
     * Sets the primary file.
     *
     * @param thePath the primary file, never null
     *
     * @return this builder, never null
     */
    public Builder<T> path(final Path thePath) {
      path = Objects.requireNonNull(thePath, "path must not be null");
      return this;
    }

    /**
     * Sets the lock retry and timeout policy.
     *
     * @param thePolicy the lock policy, never null
     *
     * @return this builder, never null
     */
    public Builder<T> lockPolicy(final LockPolicy thePolicy) {
      lockPolicy = Objects.requireNonNull(thePolicy,
          "lockPolicy must not be null");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder, never null
     */
    public Builder<T> metrics(final RadarKeepMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Builds the store.
     *
     * @return the store, never null
     */
    public FileSystemRecordStore<T> build() {
      final Path primary = (path != null ? path : defaultPath())
          .toAbsolutePath().normalize();
      final LockPolicy policy = lockPolicy != null
          ? lockPolicy : LockPolicy.defaultPolicy();
      final WriteLock lock = new LockFile(sibling(primary, LOCK_SUFFIX),
          policy);
      final FileSystemRecordStore<T> store = new FileSystemRecordStore<>(
          primary, codec, lock,
          metrics != null ? metrics : new NoopRadarKeepMetrics());
      log.info("Record store at {} (lock timeout {} ms)", primary,
          policy.timeout().toMillis());
      return store;
    }
  }
}
