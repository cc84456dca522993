package rqc.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Whether a reviewer has been asked, and agreed, to have their identity and review text
 * shared with RQC for one journal and grading year.
 */
public record ConsentRecord(
    String reviewerId,
    String journalId,
    int gradingYear,
    boolean asked,
    boolean optedIn,
    Instant answeredAt) {

  public ConsentRecord {
    Objects.requireNonNull(reviewerId, "reviewerId");
    Objects.requireNonNull(journalId, "journalId");
  }

  /** A fresh record for a reviewer who has not yet been asked. */
  public static ConsentRecord unasked(String reviewerId, String journalId, int gradingYear) {
    return new ConsentRecord(reviewerId, journalId, gradingYear, false, false, null);
  }
}
