package org.waabox.radarkeep.metrics;

/**
 * A no-operation implementation of {@link RadarKeepMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopRadarKeepMetrics implements RadarKeepMetrics {

  /** {@inheritDoc} */
  @Override
  public void lookupExecuted(final boolean matched, final long durationNs) {
  }

  /** {@inheritDoc} */
  @Override
  public void recordAppended(final String path, final int count) {
  }

  /** {@inheritDoc} */
  @Override
  public void lockTimedOut(final String path) {
  }

  /** {@inheritDoc} */
  @Override
  public void corruptionDetected(final String path) {
  }
}
