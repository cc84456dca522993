package rqc.queue;

import rqc.RqcException;

/**
 * Reason attached to an abandoned task: attempts or age ran out, or RQC refused the report
 * while draining.
 */
public class QueueExhaustedException extends RqcException {

  public QueueExhaustedException(String message) {
    super(message);
  }

  public QueueExhaustedException(String message, Throwable cause) {
    super(message, cause);
  }
}
