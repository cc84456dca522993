package rqc.host;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Host view of a manuscript.
 *
 * @param authors authors in byline order
 */
public record Submission(
    String submissionRef,
    String journalId,
    String title,
    Instant submittedAt,
    List<Person> authors) {

  public Submission {
    Objects.requireNonNull(submissionRef, "submissionRef");
    Objects.requireNonNull(journalId, "journalId");
    authors = authors == null ? List.of() : List.copyOf(authors);
  }
}
