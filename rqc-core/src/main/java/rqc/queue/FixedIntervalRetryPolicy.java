package rqc.queue;

import java.time.Duration;
import java.util.Objects;

/**
 * Retries at a constant interval regardless of how many attempts were made. The default
 * interval of one day matches a daily drain.
 */
public final class FixedIntervalRetryPolicy implements RetryPolicy {
  public static final Duration DEFAULT_INTERVAL = Duration.ofDays(1);

  private final Duration interval;

  public FixedIntervalRetryPolicy() {
    this(DEFAULT_INTERVAL);
  }

  public FixedIntervalRetryPolicy(Duration interval) {
    Objects.requireNonNull(interval, "interval");
    if (interval.isNegative()) {
      throw new IllegalArgumentException("interval must not be negative");
    }
    this.interval = interval;
  }

  @Override
  public Duration delayAfter(int attempts) {
    return interval;
  }
}
