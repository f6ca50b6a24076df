package org.waabox.radarkeep.catalog;

/**
 * Thrown when the historical radar data cannot be loaded at all.
 *
 * <p>This typically occurs when the snapshot directory or its index file
 * has not been provisioned. Lookups never see this exception:
 * {@link CatalogProvider} logs it and degrades to an empty catalog.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CatalogNotAvailableException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception indicating that the given source is not
   * available.
   *
   * @param source a description of the missing source, never null
   */
  public CatalogNotAvailableException(final String source) {
    super("Catalog not available: " + source);
  }

  /**
   * Creates a new exception indicating that the given source is not
   * available, with an underlying cause.
   *
   * @param source a description of the unreadable source, never null
   * @param cause  the underlying cause of the failure, never null
   */
  public CatalogNotAvailableException(final String source,
      final Throwable cause) {
    super("Catalog not available: " + source, cause);
  }
}
