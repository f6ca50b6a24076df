package org.waabox.radarkeep.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.radarkeep.catalog.CatalogPolicy;
import org.waabox.radarkeep.match.MatcherSettings;

/**
 * Configuration properties for RadarKeep, mapped from the
 * {@code radarkeep.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code radarkeep.catalog.dir} - the radar snapshot directory,
 *       defaults to {@code data/radar}.</li>
 *   <li>{@code radarkeep.catalog.policy} - {@code LOAD_ONCE} or
 *       {@code RELOAD_PER_LOOKUP}.</li>
 *   <li>{@code radarkeep.matcher.threshold} and
 *       {@code radarkeep.matcher.suffixes} - the matcher tuning.</li>
 *   <li>{@code radarkeep.store.path} - the submissions file. If not set,
 *       the {@code STORAGE_PATH} environment variable or
 *       {@code data/submissions.json} is used.</li>
 *   <li>{@code radarkeep.store.lock-retry-delay} and
 *       {@code radarkeep.store.lock-timeout} - the write lock policy.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "radarkeep")
public class RadarKeepProperties {

  /** The prior-radar catalog settings. */
  private final Catalog catalog = new Catalog();

  /** The matcher settings. */
  private final Matcher matcher = new Matcher();

  /** The submission store settings. */
  private final Store store = new Store();

  /**
   * Returns the prior-radar catalog settings.
   *
   * @return the catalog settings, never null
   */
  public Catalog getCatalog() {
    return catalog;
  }

  /**
   * Returns the matcher settings.
   *
   * @return the matcher settings, never null
   */
  public Matcher getMatcher() {
    return matcher;
  }

  /**
   * Returns the submission store settings.
   *
   * @return the store settings, never null
   */
  public Store getStore() {
    return store;
  }

  /** Settings of the prior-radar catalog source. */
  public static class Catalog {

    /** The directory holding index.json and the edition files. */
    private String dir = "data/radar";

    /** When to read the snapshot files. */
    private CatalogPolicy policy = CatalogPolicy.LOAD_ONCE;

    public String getDir() {
      return dir;
    }

    public void setDir(final String dir) {
      this.dir = dir;
    }

    public CatalogPolicy getPolicy() {
      return policy;
    }

    public void setPolicy(final CatalogPolicy policy) {
      this.policy = policy;
    }
  }

  /** Settings of the name matcher. */
  public static class Matcher {

    /** The minimum similarity of an approximate match. */
    private double threshold = MatcherSettings.DEFAULT_THRESHOLD;

    /** The name suffixes to strip, tried in order. */
    private List<String> suffixes =
        new ArrayList<>(MatcherSettings.DEFAULT_SUFFIXES);

    public double getThreshold() {
      return threshold;
    }

    public void setThreshold(final double threshold) {
      this.threshold = threshold;
    }

    public List<String> getSuffixes() {
      return suffixes;
    }

    public void setSuffixes(final List<String> suffixes) {
      this.suffixes = suffixes;
    }
  }

  /** Settings of the submission store. */
  public static class Store {

    /** The submissions file, null means the conventional default. */
    private String path;

    /** The delay between lock acquisition attempts. */
    private Duration lockRetryDelay = Duration.ofMillis(100);

    /** The bound on the wait for the lock. */
    private Duration lockTimeout = Duration.ofSeconds(5);

    public String getPath() {
      return path;
    }

    public void setPath(final String path) {
      this.path = path;
    }

    public Duration getLockRetryDelay() {
      return lockRetryDelay;
    }

    public void setLockRetryDelay(final Duration lockRetryDelay) {
      this.lockRetryDelay = lockRetryDelay;
    }

    public Duration getLockTimeout() {
      return lockTimeout;
    }

    public void setLockTimeout(final Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
    }
  }
}
