package rqc.model;

import java.time.Instant;
import java.util.List;

/**
 * Marks a submission whose decision reached RQC at least once. The editor set recorded here
 * is reused for every later report of the same submission.
 */
public record DeliveryRecord(
    String journalId,
    String submissionRef,
    List<EditorAssignment> editors,
    Instant firstDeliveredAt) {

  public DeliveryRecord {
    editors = editors == null ? List.of() : List.copyOf(editors);
  }
}
