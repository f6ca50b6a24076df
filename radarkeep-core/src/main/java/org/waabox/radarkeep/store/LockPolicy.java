package org.waabox.radarkeep.store;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how long and how often a writer retries a contended
 * {@link WriteLock}.
 *
 * <p>Instances are created through static factory methods. The default
 * policy retries every 100 milliseconds for up to 5 seconds.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LockPolicy {

  /** The default delay between acquisition attempts. */
  private static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(100);

  /** The default bound on the total wait. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  /** The duration to wait between acquisition attempts. */
  private final Duration retryDelay;

  /** The maximum total wait before giving up. */
  private final Duration timeout;

  /**
   * Creates a new lock policy.
   *
   * @param theRetryDelay the delay between attempts, never null
   * @param theTimeout    the bound on the total wait, never null
   */
  private LockPolicy(final Duration theRetryDelay, final Duration theTimeout) {
    retryDelay = theRetryDelay;
    timeout = theTimeout;
  }

  /**
   * Creates a lock policy with the given parameters.
   *
   * @param retryDelay the delay between acquisition attempts, must be
   *                   positive and not longer than the timeout
   * @param timeout    the bound on the total wait, must be positive
   *
   * @return a new lock policy, never null
   *
   * @throws IllegalArgumentException if a duration is zero or negative, or
   *                                  the delay exceeds the timeout
   * @throws NullPointerException     if either duration is null
   */
  public static LockPolicy of(final Duration retryDelay,
      final Duration timeout) {
    Objects.requireNonNull(retryDelay, "retryDelay must not be null");
    Objects.requireNonNull(timeout, "timeout must not be null");
    if (retryDelay.isZero() || retryDelay.isNegative()) {
      throw new IllegalArgumentException(
          "retryDelay must be positive, got: " + retryDelay);
    }
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException(
          "timeout must be positive, got: " + timeout);
    }
    if (retryDelay.compareTo(timeout) > 0) {
      throw new IllegalArgumentException("retryDelay " + retryDelay
          + " must not exceed timeout " + timeout);
    }
    return new LockPolicy(retryDelay, timeout);
  }

  /**
   * Creates a lock policy with the defaults: retry every 100 ms, give up
   * after 5 s.
   *
   * @return the default lock policy, never null
   */
  public static LockPolicy defaultPolicy() {
    return new LockPolicy(DEFAULT_RETRY_DELAY, DEFAULT_TIMEOUT);
  }

  /**
   * Returns the delay between acquisition attempts.
   *
   * @return the retry delay, never null
   */
  public Duration retryDelay() {
    return retryDelay;
  }

  /**
   * Returns the bound on the total wait.
   *
   * @return the timeout, never null
   */
  public Duration timeout() {
    return timeout;
  }
}
