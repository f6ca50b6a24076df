package org.waabox.radarkeep.store;

import java.util.Objects;

/**
 * Operational summary of a {@link RecordStore}.
 *
 * @param count the number of stored records
 * @param path  where the records are kept, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StoreStats(int count, String path) {

  /**
   * Creates a new StoreStats.
   *
   * @throws NullPointerException if path is null
   */
  public StoreStats {
    Objects.requireNonNull(path, "path must not be null");
  }
}
