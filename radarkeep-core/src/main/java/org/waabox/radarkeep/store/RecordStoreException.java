package org.waabox.radarkeep.store;

/**
 * Base exception for failures of a {@link RecordStore}.
 *
 * <p>This is an unchecked exception. When it escapes
 * {@link RecordStore#append(Object)} the write is not guaranteed, but the
 * previously committed collection is left intact.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RecordStoreException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public RecordStoreException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public RecordStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
