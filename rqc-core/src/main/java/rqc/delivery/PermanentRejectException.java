package rqc.delivery;

import rqc.RqcException;

/**
 * RQC refused a request in a way retrying cannot fix.
 */
public class PermanentRejectException extends RqcException {
  private final int statusCode;

  public PermanentRejectException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
