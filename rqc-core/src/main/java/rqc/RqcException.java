package rqc;

/**
 * Base unchecked exception for the RQC adapter.
 */
public class RqcException extends RuntimeException {

  public RqcException(String message) {
    super(message);
  }

  public RqcException(String message, Throwable cause) {
    super(message, cause);
  }
}
