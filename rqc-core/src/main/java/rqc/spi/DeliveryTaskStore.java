package rqc.spi;

import rqc.model.DeliveryTask;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for the durable retry queue.
 *
 * <p>At most one outstanding (pending or in-flight) task exists per task key. Implementations
 * enforce this with a unique column that holds the key while the task is outstanding and is
 * cleared on abandonment.
 *
 * @see rqc.queue.DurableRetryQueue
 */
public interface DeliveryTaskStore {

  /**
   * Inserts {@code task} or, when an outstanding task with the same key exists, replaces that
   * task's payload and bumps its revision. Must be a single atomic statement.
   */
  void upsert(Connection conn, DeliveryTask task);

  /**
   * Inserts {@code task} unless an outstanding task with the same key exists, in which case that
   * task is left untouched.
   *
   * @return true if inserted
   */
  boolean insertIfAbsent(Connection conn, DeliveryTask task);

  Optional<DeliveryTask> findOutstanding(Connection conn, String taskKey);

  /**
   * Lists tasks a drain may claim: pending tasks due at {@code now}, and in-flight tasks whose
   * claim is older than {@code lockExpiry}. Oldest first.
   */
  List<DeliveryTask> findDue(Connection conn, Instant now, Instant lockExpiry, int limit);

  /**
   * Claims a task for {@code ownerId} with a compare-and-set update.
   *
   * @return 1 if claimed, 0 if another drain got there first or the task is no longer due
   */
  int claim(Connection conn, String taskId, String ownerId, Instant now, Instant lockExpiry);

  /**
   * Deletes a delivered task, provided its revision is unchanged.
   *
   * @return rows deleted; 0 means a newer payload was merged while the attempt was in flight
   */
  int markDelivered(Connection conn, String taskId, long revision);

  /**
   * Returns the task to pending with one more attempt counted.
   */
  int markRetry(Connection conn, String taskId, Instant nextAttemptAt, String error);

  /**
   * Returns the task to pending without counting an attempt.
   */
  int markDeferred(Connection conn, String taskId, Instant nextAttemptAt, String reason);

  /**
   * Moves a task claimed by {@code ownerId} to the terminal abandoned state and releases its
   * task key for new decisions.
   *
   * @param attempts total attempts made, recorded for audit
   * @return 1 if this call abandoned it, 0 if it was not held by {@code ownerId}
   */
  int markAbandoned(Connection conn, String taskId, String ownerId, int attempts, Instant abandonedAt,
      String error);

  /**
   * Lists abandoned tasks, oldest first.
   *
   * @param journalId optional journal filter ({@code null} for all)
   */
  List<DeliveryTask> queryAbandoned(Connection conn, String journalId, int limit);

  int countAbandoned(Connection conn, String journalId);

  /**
   * Deletes an abandoned task.
   *
   * @return rows deleted; 0 if the task is not abandoned
   */
  int deleteAbandoned(Connection conn, String taskId);

  /** Counts pending and in-flight tasks. */
  int countOutstanding(Connection conn);
}
