package dev.tutordesk.sheet;

/** Failure reading or writing an external row store. */
public class RowStoreException extends RuntimeException {

  public RowStoreException(String message) {
    super(message);
  }

  public RowStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
