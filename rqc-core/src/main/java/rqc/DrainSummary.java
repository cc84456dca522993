package rqc;

/**
 * Counts from one sweep of the retry queue.
 *
 * @param attempted tasks for which a delivery attempt was made
 * @param succeeded attempts that delivered
 * @param abandoned tasks moved to the terminal abandoned state during this sweep
 * @param deferred  tasks skipped because their journal credentials were not usable
 */
public record DrainSummary(int attempted, int succeeded, int abandoned, int deferred) {

  public static final DrainSummary EMPTY = new DrainSummary(0, 0, 0, 0);

  public DrainSummary plus(DrainSummary other) {
    return new DrainSummary(
        attempted + other.attempted,
        succeeded + other.succeeded,
        abandoned + other.abandoned,
        deferred + other.deferred);
  }
}
