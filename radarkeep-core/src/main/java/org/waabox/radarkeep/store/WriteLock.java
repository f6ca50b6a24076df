package org.waabox.radarkeep.store;

/**
 * A mutual-exclusion lock guarding the read-modify-write cycle of a
 * {@link RecordStore}.
 *
 * <p>The contract is a mutex with a liveness timeout: at most one holder
 * at a time, a bounded wait for everybody else, and release on every exit
 * path. A holder that dies without releasing is reclaimed by the next
 * waiter once its wait times out.
 *
 * <p>Implementations can use different mechanisms (e.g. a create-exclusive
 * lock file, an OS advisory lock, a database row lock).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface WriteLock {

  /**
   * Blocks until the lock is held by the caller.
   *
   * @throws LockTimeoutException if the lock could not be acquired within
   *                              the configured bound
   */
  void acquire();

  /**
   * Releases the lock.
   *
   * <p>Must be called exactly once after a successful {@link #acquire()},
   * whatever the outcome of the guarded work. Never throws.
   */
  void release();
}
