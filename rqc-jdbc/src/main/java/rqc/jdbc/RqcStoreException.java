package rqc.jdbc;

import rqc.RqcException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the adapter's JDBC stores.
 */
public final class RqcStoreException extends RqcException {
  public RqcStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
