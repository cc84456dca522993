package rqc.queue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link InFlightTracker}. Each held task key remembers when it was taken.
 *
 * <p>By default a key stays held until released. With a maximum hold time, a holder older than
 * that limit is displaced by the next caller, so a wedged delivery cannot block its submission
 * for the lifetime of the process.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<String, Instant> heldSince = new ConcurrentHashMap<>();
  private final Duration maxHold;
  private final Clock clock;

  public DefaultInFlightTracker() {
    this(Duration.ZERO, Clock.systemUTC());
  }

  /**
   * @param maxHold how long a key may be held before another caller can take it over;
   *     {@link Duration#ZERO} holds keys until released
   */
  public DefaultInFlightTracker(Duration maxHold, Clock clock) {
    Objects.requireNonNull(maxHold, "maxHold");
    if (maxHold.isNegative()) {
      throw new IllegalArgumentException("maxHold must not be negative");
    }
    this.maxHold = maxHold;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public boolean tryAcquire(String taskKey) {
    Instant now = clock.instant();
    Instant holder = heldSince.putIfAbsent(taskKey, now);
    if (holder == null) {
      return true;
    }
    boolean expired = !maxHold.isZero() && holder.plus(maxHold).isBefore(now);
    return expired && heldSince.replace(taskKey, holder, now);
  }

  @Override
  public void release(String taskKey) {
    heldSince.remove(taskKey);
  }

  int heldCount() {
    return heldSince.size();
  }
}
