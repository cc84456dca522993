package rqc.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import rqc.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Every report outcome increments one counter, {@code <prefix>.reports}, tagged with
 * {@code outcome}:
 * <ul>
 *   <li>{@code delivered}: RQC accepted the report</li>
 *   <li>{@code queued}: the report went to the retry queue</li>
 *   <li>{@code merged}: the decision replaced the payload of an outstanding task</li>
 *   <li>{@code rejected}: RQC refused the report</li>
 *   <li>{@code retried}: a failed retry was rescheduled</li>
 *   <li>{@code abandoned}: a task was given up on</li>
 *   <li>{@code deferred}: a retry waited for usable credentials</li>
 * </ul>
 *
 * <p>The gauge {@code <prefix>.queue.depth} holds the number of outstanding tasks counted at
 * the end of the last drain.
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private enum Outcome { DELIVERED, QUEUED, MERGED, REJECTED, RETRIED, ABANDONED, DEFERRED }

  private final MeterRegistry registry;
  private final Map<Outcome, Counter> outcomes = new EnumMap<>(Outcome.class);
  private final AtomicInteger depth = new AtomicInteger();
  private final Gauge depthGauge;
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "rqc");
  }

  /**
   * @param namePrefix prefix for all meter names, e.g. {@code "journals.rqc"}
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    this.registry = Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty() || namePrefix.startsWith(".") || namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("Invalid namePrefix: '" + namePrefix + "'");
    }

    for (Outcome outcome : Outcome.values()) {
      outcomes.put(outcome, Counter.builder(namePrefix + ".reports")
          .description("RQC decision reports by outcome")
          .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    this.depthGauge = Gauge.builder(namePrefix + ".queue.depth", depth, AtomicInteger::get)
        .description("Outstanding RQC delivery tasks")
        .register(registry);
  }

  private void count(Outcome outcome) {
    if (!closed) {
      outcomes.get(outcome).increment();
    }
  }

  @Override
  public void incrementDelivered() {
    count(Outcome.DELIVERED);
  }

  @Override
  public void incrementQueued() {
    count(Outcome.QUEUED);
  }

  @Override
  public void incrementMerged() {
    count(Outcome.MERGED);
  }

  @Override
  public void incrementRejected() {
    count(Outcome.REJECTED);
  }

  @Override
  public void incrementRetried() {
    count(Outcome.RETRIED);
  }

  @Override
  public void incrementAbandoned() {
    count(Outcome.ABANDONED);
  }

  @Override
  public void incrementDeferred() {
    count(Outcome.DEFERRED);
  }

  @Override
  public void recordOutstandingDepth(int depth) {
    if (!closed) {
      this.depth.set(depth);
    }
  }

  /**
   * Removes this exporter's meters from the registry. Later updates are ignored.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(outcomes.values());
    meters.add(depthGauge);
    RuntimeException failure = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
