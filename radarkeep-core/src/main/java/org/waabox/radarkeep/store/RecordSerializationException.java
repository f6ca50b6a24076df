package org.waabox.radarkeep.store;

/**
 * Thrown when the record collection cannot be encoded or decoded, or when
 * a committed write fails its verification read.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RecordSerializationException extends RecordStoreException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public RecordSerializationException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public RecordSerializationException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
