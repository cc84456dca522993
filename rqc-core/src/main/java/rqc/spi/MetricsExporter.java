package rqc.spi;

/**
 * Observability hook for exporting delivery counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of decision reports RQC accepted, synchronously or from the queue.
   */
  void incrementDelivered();

  /**
   * Increments the count of decision reports placed in the retry queue.
   */
  void incrementQueued();

  /**
   * Increments the count of reports that replaced the payload of an outstanding task.
   */
  default void incrementMerged() {
  }

  /**
   * Increments the count of reports rejected for bad credentials or bad payloads.
   */
  void incrementRejected();

  /**
   * Increments the count of queued attempts that failed and were rescheduled.
   */
  void incrementRetried();

  /**
   * Increments the count of tasks that became abandoned.
   */
  void incrementAbandoned();

  /**
   * Increments the count of tasks skipped because their journal had no usable credentials.
   */
  default void incrementDeferred() {
  }

  /**
   * Records the number of outstanding tasks seen at the end of a drain.
   *
   * @param depth pending plus in-flight tasks
   */
  default void recordOutstandingDepth(int depth) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementDelivered() {
    }

    @Override
    public void incrementQueued() {
    }

    @Override
    public void incrementRejected() {
    }

    @Override
    public void incrementRetried() {
    }

    @Override
    public void incrementAbandoned() {
    }
  }
}
