package org.waabox.radarkeep.store.fs;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.radarkeep.store.LockPolicy;
import org.waabox.radarkeep.store.LockTimeoutException;
import org.waabox.radarkeep.store.RecordStoreException;
import org.waabox.radarkeep.store.WriteLock;

/**
 * A {@link WriteLock} backed by a marker file created with
 * create-exclusive semantics.
 *
 * <p>Whoever manages to create the marker holds the lock; everybody else
 * retries every {@link LockPolicy#retryDelay()} until the marker is gone
 * or {@link LockPolicy#timeout()} elapses. A waiter that times out treats
 * the marker as left behind by a dead holder, deletes it and reports a
 * {@link LockTimeoutException}, so the next writer can proceed.
 *
 * <p>The filesystem is the only shared state, which makes the lock hold
 * across independent processes, not just threads. The marker contains the
 * id of the owning process to help diagnosing a stuck lock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LockFile implements WriteLock {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(LockFile.class);

  /** The marker file, never null. */
  private final Path path;

  /** The retry and timeout policy, never null. */
  private final LockPolicy policy;

  /**
   * Creates a new LockFile.
   *
   * @param thePath   the marker file, never null
   * @param thePolicy the retry and timeout policy, never null
   *
   * @throws NullPointerException if any argument is null
   */
  public LockFile(final Path thePath, final LockPolicy thePolicy) {
    path = Objects.requireNonNull(thePath, "path must not be null");
    policy = Objects.requireNonNull(thePolicy, "policy must not be null");
  }

  /**
   * {@inheritDoc}
   *
   * <p>On timeout the existing marker is force-removed before the
   * exception is raised. If the waiting thread is interrupted the
   * interrupt flag is restored and the wait ends with a
   * {@link LockTimeoutException} as well.
   *
   * @throws RecordStoreException if the marker cannot be created for a
   *                              reason other than contention
   */
  @Override
  public void acquire() {
    final long deadline = System.nanoTime() + policy.timeout().toNanos();
    int attempts = 0;

    while (true) {
      attempts++;
      if (tryCreate()) {
        log.debug("Acquired lock {} after {} attempt(s)", path, attempts);
        return;
      }

      if (System.nanoTime() - deadline >= 0) {
        log.warn("Lock {} still held after {} ms, removing it as stale",
            path, policy.timeout().toMillis());
        forceClear();
        throw new LockTimeoutException(path.toString(), policy.timeout());
      }

      try {
        Thread.sleep(policy.retryDelay().toMillis());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new LockTimeoutException(path.toString(), e);
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void release() {
    try {
      Files.deleteIfExists(path);
    } catch (final IOException e) {
      log.warn("Failed to release lock {}, the next writer will reclaim it"
          + " after its timeout", path, e);
    }
  }

  /**
   * Returns the marker file of this lock.
   *
   * @return the marker path, never null
   */
  public Path path() {
    return path;
  }

  /**
   * Attempts to create the marker file.
   *
   * @return {@code true} if this call created it, {@code false} if it
   *         already exists
   */
  private boolean tryCreate() {
    try {
      Files.writeString(path, Long.toString(ProcessHandle.current().pid()),
          StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      return true;
    } catch (final FileAlreadyExistsException e) {
      return false;
    } catch (final IOException e) {
      throw new RecordStoreException("Failed to create lock file " + path, e);
    }
  }

  /** Deletes a marker presumed to be stale. */
  private void forceClear() {
    try {
      Files.deleteIfExists(path);
    } catch (final IOException e) {
      log.warn("Failed to remove stale lock {}", path, e);
    }
  }
}
