package rqc.host;

import java.time.Instant;
import java.util.Objects;

/**
 * Host view of one review assignment.
 *
 * @param reviewer          the invited reviewer
 * @param accepted          whether the reviewer agreed to review
 * @param authenticated     {@code false} when the review was submitted through one-click access
 * @param text              the review text
 * @param requestedAt       invitation time; orders reviews within a submission
 * @param acceptedAt        when the invitation was accepted
 * @param dueAt             due date
 * @param completedAt       when the review was submitted
 * @param recommendation    the reviewer's recommendation as a host decision code, may be {@code null}
 * @param gradingYear       RQC grading year the review counts towards
 */
public record Review(
    Person reviewer,
    boolean accepted,
    boolean authenticated,
    String text,
    Instant requestedAt,
    Instant acceptedAt,
    Instant dueAt,
    Instant completedAt,
    String recommendation,
    int gradingYear) {

  public Review {
    Objects.requireNonNull(reviewer, "reviewer");
  }
}
