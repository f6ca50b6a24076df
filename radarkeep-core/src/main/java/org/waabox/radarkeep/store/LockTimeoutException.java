package org.waabox.radarkeep.store;

import java.time.Duration;

/**
 * Thrown when a writer cannot obtain exclusive access to a store within
 * the configured bound.
 *
 * <p>Nothing was written. The lock holder is presumed dead and its marker
 * has been cleared, so retrying the whole append later is safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LockTimeoutException extends RecordStoreException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for a lock that was not acquired in time.
   *
   * @param lockName a description of the lock, never null
   * @param timeout  how long the writer waited, never null
   */
  public LockTimeoutException(final String lockName, final Duration timeout) {
    super("Failed to acquire lock " + lockName + " within "
        + timeout.toMillis() + " ms");
  }

  /**
   * Creates a new exception for a wait that was cut short.
   *
   * @param lockName a description of the lock, never null
   * @param cause    the underlying cause, never null
   */
  public LockTimeoutException(final String lockName, final Throwable cause) {
    super("Interrupted while waiting for lock " + lockName, cause);
  }
}
