package org.waabox.radarkeep.catalog;

/**
 * A strategy for loading the historical radar editions.
 *
 * <p>Implementations read every edition from their source (bundled files,
 * classpath, a test fixture) and return them as one immutable snapshot.
 * The loader is invoked once per process or once per lookup, depending on
 * the {@link CatalogPolicy} of the owning {@link CatalogProvider}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface CatalogLoader {

  /**
   * Loads all editions from the underlying source.
   *
   * <p>An empty catalog is a valid result. A source that is entirely
   * absent is reported with {@link CatalogNotAvailableException}.
   *
   * @return the loaded catalog, never null
   *
   * @throws CatalogNotAvailableException if the source does not exist or
   *                                      cannot be read at all
   */
  RadarCatalog load();
}
