package org.waabox.radarkeep.catalog;

/**
 * When a {@link CatalogProvider} goes back to its {@link CatalogLoader}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum CatalogPolicy {

  /** Load on first use and keep the snapshot for the process lifetime. */
  LOAD_ONCE,

  /** Re-read the source on every lookup. */
  RELOAD_PER_LOOKUP
}
