package rqc.queue;

import java.time.Duration;

/**
 * Decides when a failed decision report is attempted again.
 *
 * @see FixedIntervalRetryPolicy
 */
public interface RetryPolicy {

  /**
   * @param attempts attempts made so far, the failed one included
   * @return wait before the next attempt, never negative
   */
  Duration delayAfter(int attempts);
}
