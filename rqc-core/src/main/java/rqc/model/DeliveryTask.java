package rqc.model;

import java.time.Instant;

/**
 * A persisted decision report awaiting (re)delivery.
 *
 * @param taskId        unique ULID of this task
 * @param taskKey       journal and submission key, see {@link #taskKey(String, String)}
 * @param journalId     journal the report belongs to
 * @param submissionRef submission the report belongs to
 * @param payload       serialized {@link DecisionEvent}
 * @param revision      bumped every time a newer decision replaces the payload
 * @param attempts      delivery attempts made so far
 * @param createdAt     when the task was first queued
 * @param nextAttemptAt earliest time the next drain may attempt it
 * @param state         lifecycle state
 * @param lastError     reason of the last failure
 * @param lockedBy      drain owner holding the claim, while in flight
 * @param lockedAt      when the claim was taken
 * @param abandonedAt   when the task became terminal
 */
public record DeliveryTask(
    String taskId,
    String taskKey,
    String journalId,
    String submissionRef,
    String payload,
    long revision,
    int attempts,
    Instant createdAt,
    Instant nextAttemptAt,
    TaskState state,
    String lastError,
    String lockedBy,
    Instant lockedAt,
    Instant abandonedAt) {

  public static String taskKey(String journalId, String submissionRef) {
    return journalId + ":" + submissionRef;
  }
}
