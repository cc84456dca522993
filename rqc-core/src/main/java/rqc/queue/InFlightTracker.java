package rqc.queue;

/**
 * In-process guard that serializes delivery work on one submission. Keys are task keys.
 */
public interface InFlightTracker {
  boolean tryAcquire(String taskKey);

  void release(String taskKey);
}
