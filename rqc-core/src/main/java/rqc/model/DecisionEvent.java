package rqc.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A fully normalized editorial decision, ready to be sent to RQC.
 *
 * <p>Immutable once built. The retry queue stores and replays it verbatim.
 */
public record DecisionEvent(
    String journalId,
    String submissionRef,
    String title,
    Instant submittedAt,
    DecisionKind decisionKind,
    List<AuthorRef> authors,
    List<EditorAssignment> editors,
    List<ReviewPayload> reviews,
    Instant createdAt) {

  public DecisionEvent {
    Objects.requireNonNull(journalId, "journalId");
    Objects.requireNonNull(submissionRef, "submissionRef");
    Objects.requireNonNull(decisionKind, "decisionKind");
    authors = authors == null ? List.of() : List.copyOf(authors);
    editors = editors == null ? List.of() : List.copyOf(editors);
    reviews = reviews == null ? List.of() : List.copyOf(reviews);
  }

  /** Retry-queue key: one outstanding task per journal and submission. */
  public String taskKey() {
    return DeliveryTask.taskKey(journalId, submissionRef);
  }
}
