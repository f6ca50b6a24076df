package org.waabox.radarkeep.catalog;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the current {@link RadarCatalog} snapshot and decides when to go
 * back to the {@link CatalogLoader}.
 *
 * <p>Readers receive an immutable snapshot and never observe a partially
 * loaded catalog: a new snapshot is built completely and then swapped in.
 * Loads are serialized so that concurrent first lookups trigger a single
 * read of the source.
 *
 * <p>Load failures never reach the caller. A
 * {@link CatalogNotAvailableException} (or any other runtime failure of
 * the loader) is logged and the empty catalog is handed out instead, so a
 * missing data set turns prior-radar matching off rather than breaking
 * the submission flow.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogProvider {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CatalogProvider.class);

  /** The loader that reads the editions, never null. */
  private final CatalogLoader loader;

  /** When to go back to the loader, never null. */
  private final CatalogPolicy policy;

  /** The loaded snapshot, null until the first load. */
  private final AtomicReference<RadarCatalog> current;

  /** Serializes loads. */
  private final ReentrantLock loadLock;

  /**
   * Creates a new CatalogProvider.
   *
   * @param theLoader the catalog loader, never null
   * @param thePolicy the load policy, never null
   */
  private CatalogProvider(final CatalogLoader theLoader,
      final CatalogPolicy thePolicy) {
    loader = theLoader;
    policy = thePolicy;
    current = new AtomicReference<>();
    loadLock = new ReentrantLock();
  }

  /**
   * Creates a provider over the given loader.
   *
   * @param loader the catalog loader, never null
   * @param policy the load policy, never null
   *
   * @return the provider, never null
   *
   * @throws NullPointerException if loader or policy is null
   */
  public static CatalogProvider of(final CatalogLoader loader,
      final CatalogPolicy policy) {
    Objects.requireNonNull(loader, "loader must not be null");
    Objects.requireNonNull(policy, "policy must not be null");
    return new CatalogProvider(loader, policy);
  }

  /**
   * Creates a provider that always hands out the given snapshot.
   *
   * @param catalog the snapshot to hand out, never null
   *
   * @return the provider, never null
   *
   * @throws NullPointerException if catalog is null
   */
  public static CatalogProvider fixed(final RadarCatalog catalog) {
    Objects.requireNonNull(catalog, "catalog must not be null");
    return new CatalogProvider(() -> catalog, CatalogPolicy.LOAD_ONCE);
  }

  /**
   * Returns the catalog snapshot to match against.
   *
   * <p>Under {@link CatalogPolicy#LOAD_ONCE} the first call loads the
   * catalog and later calls return the same snapshot without any I/O.
   * Under {@link CatalogPolicy#RELOAD_PER_LOOKUP} every call reloads.
   *
   * @return the current snapshot, never null, empty if loading failed
   */
  public RadarCatalog current() {
    if (policy == CatalogPolicy.RELOAD_PER_LOOKUP) {
      return refresh();
    }
    final RadarCatalog loaded = current.get();
    if (loaded != null) {
      return loaded;
    }
    loadLock.lock();
    try {
      final RadarCatalog raced = current.get();
      if (raced != null) {
        return raced;
      }
      final RadarCatalog catalog = loadOrEmpty();
      current.set(catalog);
      return catalog;
    } finally {
      loadLock.unlock();
    }
  }

  /**
   * Reloads the catalog from the loader and swaps it in, regardless of
   * the policy.
   *
   * @return the new snapshot, never null, empty if loading failed
   */
  public RadarCatalog refresh() {
    loadLock.lock();
    try {
      final RadarCatalog catalog = loadOrEmpty();
      current.set(catalog);
      return catalog;
    } finally {
      loadLock.unlock();
    }
  }

  /**
   * Returns the load policy of this provider.
   *
   * @return the policy, never null
   */
  public CatalogPolicy policy() {
    return policy;
  }

  /**
   * Invokes the loader, degrading every failure to the empty catalog.
   *
   * @return the loaded catalog or the empty catalog, never null
   */
  private RadarCatalog loadOrEmpty() {
    try {
      final RadarCatalog catalog = loader.load();
      if (catalog == null) {
        log.warn("Catalog loader returned null, prior radar matching is"
            + " disabled");
        return RadarCatalog.empty();
      }
      return catalog;
    } catch (final CatalogNotAvailableException e) {
      log.warn("{}. Prior radar matching is disabled until the radar data"
          + " is provisioned", e.getMessage());
      return RadarCatalog.empty();
    } catch (final RuntimeException e) {
      log.warn("Failed to load the radar catalog, prior radar matching is"
          + " disabled", e);
      return RadarCatalog.empty();
    }
  }
}
