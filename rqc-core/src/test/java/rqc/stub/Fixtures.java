package rqc.stub;

import rqc.host.HostEditorAssignment;
import rqc.host.HostEditorRole;
import rqc.host.Person;
import rqc.host.Review;
import rqc.host.Submission;
import rqc.model.DecisionEvent;
import rqc.model.DecisionKind;

import java.time.Instant;
import java.util.List;

public final class Fixtures {
  public static final String JOURNAL = "J1";
  public static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

  private Fixtures() {}

  public static Person person(String id) {
    return new Person(id, id + "@uni.example", "First" + id, "Last" + id, "0000-0000-0000-000" + id.length());
  }

  public static Submission submission(String ref) {
    return new Submission(ref, JOURNAL, "On " + ref, T0.minusSeconds(86_400 * 30),
        List.of(person("a1"), person("a2")));
  }

  public static List<HostEditorAssignment> editors() {
    return List.of(
        new HostEditorAssignment(person("se"), HostEditorRole.SECTION_EDITOR),
        new HostEditorAssignment(person("ed"), HostEditorRole.EDITOR));
  }

  public static Review review(String reviewerId, boolean authenticated, Instant requestedAt) {
    return new Review(person(reviewerId), true, authenticated, "Review text by " + reviewerId,
        requestedAt, requestedAt.plusSeconds(3600), requestedAt.plusSeconds(86_400 * 14),
        requestedAt.plusSeconds(86_400 * 10), "minor_revisions", 2026);
  }

  public static DecisionEvent event(String submissionRef) {
    return new DecisionEvent(JOURNAL, submissionRef, "On " + submissionRef, T0, DecisionKind.ACCEPT,
        List.of(), List.of(), List.of(), T0);
  }
}
