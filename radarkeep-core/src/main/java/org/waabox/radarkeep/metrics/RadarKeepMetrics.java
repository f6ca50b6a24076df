package org.waabox.radarkeep.metrics;

/**
 * An abstraction for recording operational metrics of prior-radar
 * lookups and submission writes.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopRadarKeepMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RadarKeepMetrics {

  /**
   * Records a completed prior-radar lookup.
   *
   * @param matched    whether an entry was matched
   * @param durationNs the lookup duration in nanoseconds
   */
  void lookupExecuted(boolean matched, long durationNs);

  /**
   * Records a committed append.
   *
   * @param path  the primary file the record was appended to, never null
   * @param count the number of records stored after the append
   */
  void recordAppended(String path, int count);

  /**
   * Records a writer giving up on the lock.
   *
   * @param path the primary file whose lock timed out, never null
   */
  void lockTimedOut(String path);

  /**
   * Records a primary file that could not be parsed and was read as an
   * empty collection.
   *
   * @param path the corrupted primary file, never null
   */
  void corruptionDetected(String path);
}
