package rqc.normalize;

import rqc.consent.ConsentService;
import rqc.host.HostDecisionKind;
import rqc.host.HostEditorAssignment;
import rqc.host.HostEditorRole;
import rqc.host.Person;
import rqc.host.Review;
import rqc.host.Submission;
import rqc.model.AuthorRef;
import rqc.model.ConsentRecord;
import rqc.model.DecisionEvent;
import rqc.model.DecisionKind;
import rqc.model.EditorAssignment;
import rqc.model.EditorLevel;
import rqc.model.PersonRef;
import rqc.model.ReviewPayload;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Translates host workflow state into the RQC taxonomy.
 *
 * <p>Performs no I/O. Consent records and the pseudonymizer are looked up by the caller and
 * passed in, so the same inputs always produce the same {@link DecisionEvent}.
 */
public final class EventNormalizer {
  private static final Logger logger = Logger.getLogger(EventNormalizer.class.getName());

  private static final Comparator<Review> BY_INVITATION =
      Comparator.comparing(Review::requestedAt, Comparator.nullsLast(Comparator.naturalOrder()));

  private final boolean withholdAnonymousContent;

  /**
   * @param withholdAnonymousContent whether review text of anonymized reviewers is left out
   */
  public EventNormalizer(boolean withholdAnonymousContent) {
    this.withholdAnonymousContent = withholdAnonymousContent;
  }

  /**
   * Maps host roles to editor levels. Section editors become level 1; assigned and deciding
   * editors become level 3. A person holding both appears once, at level 3. Level 1 entries
   * come first, each level in order of first appearance.
   */
  public List<EditorAssignment> mapEditors(List<HostEditorAssignment> assignments) {
    Map<String, Person> level1 = new LinkedHashMap<>();
    Map<String, Person> level3 = new LinkedHashMap<>();
    for (HostEditorAssignment assignment : assignments) {
      Person editor = assignment.editor();
      if (isLevel3(assignment.role())) {
        level3.putIfAbsent(editor.personId(), editor);
      } else {
        level1.putIfAbsent(editor.personId(), editor);
      }
    }
    level1.keySet().removeAll(level3.keySet());

    List<EditorAssignment> result = new ArrayList<>();
    level1.values().forEach(p -> result.add(new EditorAssignment(ref(p), EditorLevel.SECTION_EDITOR)));
    level3.values().forEach(p -> result.add(new EditorAssignment(ref(p), EditorLevel.EDITOR)));
    return cap(result, "editors");
  }

  private static boolean isLevel3(HostEditorRole role) {
    return role == HostEditorRole.EDITOR || role == HostEditorRole.DECISION_AUTHOR;
  }

  public DecisionKind mapDecision(HostDecisionKind kind) {
    return switch (kind) {
      case ACCEPT -> DecisionKind.ACCEPT;
      case CONDITIONAL_ACCEPT, MINOR_REVISIONS -> DecisionKind.MINOR_REVISION;
      case MAJOR_REVISIONS -> DecisionKind.MAJOR_REVISION;
      case REJECT -> DecisionKind.REJECT;
    };
  }

  /**
   * @throws UnmappableDecisionException for codes outside the known set
   */
  public DecisionKind mapDecision(String hostCode) {
    HostDecisionKind kind = HostDecisionKind.fromCode(hostCode);
    if (kind == null) {
      throw new UnmappableDecisionException(hostCode);
    }
    return mapDecision(kind);
  }

  /**
   * Maps one review. Without consent (or for one-click access) the reviewer is replaced by a
   * pseudonymous token and, by default, the text is withheld.
   */
  public ReviewPayload mapReview(Review review, ConsentRecord consent, boolean authenticated,
      ReviewerPseudonymizer pseudonymizer, int visibleId) {
    boolean anonymous = ConsentService.requiresAnonymization(consent, authenticated);
    PersonRef reviewer;
    String content;
    if (anonymous) {
      reviewer = PersonRef.pseudonymous(pseudonymizer.tokenFor(review.reviewer().personId()));
      content = withholdAnonymousContent ? "" : WireLimits.text(review.text());
    } else {
      reviewer = ref(review.reviewer());
      content = WireLimits.text(review.text());
    }
    HostDecisionKind suggestion = HostDecisionKind.fromCode(review.recommendation());
    return new ReviewPayload(
        visibleId,
        reviewer,
        anonymous,
        content,
        review.requestedAt(),
        review.acceptedAt(),
        review.dueAt(),
        review.completedAt(),
        suggestion == null ? null : mapDecision(suggestion));
  }

  /**
   * Keeps accepted reviews only, ordered by invitation date, at most
   * {@link WireLimits#MAX_LIST_SIZE}.
   */
  public List<Review> selectReviews(List<Review> reviews) {
    List<Review> accepted = reviews.stream()
        .filter(Review::accepted)
        .sorted(BY_INVITATION)
        .toList();
    return cap(accepted, "reviews");
  }

  /**
   * Builds the complete event.
   *
   * @param editors      already mapped editors (possibly a recorded, frozen set)
   * @param reviews      host reviews; filtered and ordered by {@link #selectReviews}
   * @param consentOf    consent record of each review's reviewer, may return {@code null}
   */
  public DecisionEvent normalize(Submission submission, DecisionKind decisionKind,
      List<EditorAssignment> editors, List<Review> reviews, Function<Review, ConsentRecord> consentOf,
      ReviewerPseudonymizer pseudonymizer, Instant createdAt) {
    List<AuthorRef> authors = new ArrayList<>();
    int order = 1;
    for (Person author : cap(submission.authors(), "authors")) {
      authors.add(new AuthorRef(ref(author), order++));
    }

    List<ReviewPayload> payloads = new ArrayList<>();
    int visibleId = 1;
    for (Review review : selectReviews(reviews)) {
      payloads.add(mapReview(review, consentOf.apply(review), review.authenticated(), pseudonymizer, visibleId++));
    }

    return new DecisionEvent(
        submission.journalId(),
        submission.submissionRef(),
        WireLimits.line(submission.title()),
        submission.submittedAt(),
        decisionKind,
        authors,
        cap(editors, "editors"),
        payloads,
        createdAt);
  }

  private static PersonRef ref(Person person) {
    return new PersonRef(
        WireLimits.line(person.email()),
        WireLimits.line(person.firstName()),
        WireLimits.line(person.lastName()),
        WireLimits.line(person.orcid()));
  }

  private static <T> List<T> cap(List<T> items, String what) {
    if (items.size() <= WireLimits.MAX_LIST_SIZE) {
      return items;
    }
    logger.log(Level.WARNING, "Dropping {0} of {1} {2} beyond the RQC limit of {3}",
        new Object[]{items.size() - WireLimits.MAX_LIST_SIZE, items.size(), what, WireLimits.MAX_LIST_SIZE});
    return List.copyOf(items.subList(0, WireLimits.MAX_LIST_SIZE));
  }
}
