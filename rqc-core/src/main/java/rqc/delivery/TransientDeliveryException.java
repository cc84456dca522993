package rqc.delivery;

import rqc.RqcException;

/**
 * RQC could not be reached, or answered with an error worth retrying.
 */
public class TransientDeliveryException extends RqcException {

  public TransientDeliveryException(String message) {
    super(message);
  }

  public TransientDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
