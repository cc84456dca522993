package rqc.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import rqc.delivery.GradingRequest;
import rqc.model.AuthorRef;
import rqc.model.DecisionEvent;
import rqc.model.EditorAssignment;
import rqc.model.JournalCredential;
import rqc.model.PersonRef;
import rqc.model.ReviewPayload;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Builds the JSON request bodies RQC expects.
 *
 * <p>Timestamps are UTC with second precision ({@code 2026-03-02T08:00:00Z}); empty ORCID
 * values are sent as {@code null}; review attachments are always an empty list.
 */
public final class WireFormat {
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

  private final ObjectMapper mapper;

  public WireFormat(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static String timestamp(Instant instant) {
    return instant == null ? null : TIMESTAMP.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }

  public ObjectNode credentialCheck(JournalCredential credential) {
    return credentials(credential);
  }

  public ObjectNode gradingRequest(JournalCredential credential, GradingRequest request) {
    ObjectNode body = credentials(credential);
    body.put("external_uid", request.submissionRef());
    String user = request.interactiveUser() == null ? "" : request.interactiveUser();
    body.put("interactive_user", user);
    // RQC only redirects back when an interactive user is named
    body.put("mhs_submissionpage", user.isEmpty() || request.returnUrl() == null ? "" : request.returnUrl());
    return body;
  }

  public ObjectNode decisionReport(JournalCredential credential, DecisionEvent event) {
    ObjectNode body = credentials(credential);
    body.put("external_uid", event.submissionRef());
    body.put("visible_uid", event.submissionRef());
    body.put("title", event.title());
    body.put("submitted", timestamp(event.submittedAt()));
    body.put("decision", event.decisionKind().wireName());
    body.put("interactive_user", "");
    body.put("mhs_submissionpage", "");

    ArrayNode authors = body.putArray("author_set");
    for (AuthorRef author : event.authors()) {
      person(authors.addObject(), author.person()).put("order_number", author.order());
    }
    ArrayNode editors = body.putArray("edassgmt_set");
    for (EditorAssignment editor : event.editors()) {
      person(editors.addObject(), editor.editor()).put("level", editor.level().code());
    }
    ArrayNode reviews = body.putArray("review_set");
    for (ReviewPayload review : event.reviews()) {
      review(reviews.addObject(), review);
    }
    return body;
  }

  private void review(ObjectNode node, ReviewPayload review) {
    node.put("visible_id", String.valueOf(review.visibleId()));
    node.put("invited", timestamp(review.invitedAt()));
    node.put("agreed", timestamp(review.agreedAt()));
    node.put("expected", timestamp(review.expectedAt()));
    node.put("submitted", timestamp(review.submittedAt()));
    node.put("text", review.content());
    node.put("is_html", true);
    node.put("suggested_decision",
        review.suggestedDecision() == null ? null : review.suggestedDecision().wireName());
    person(node.putObject("reviewer"), review.reviewer());
    node.putArray("attachment_set");
  }

  private ObjectNode credentials(JournalCredential credential) {
    ObjectNode body = mapper.createObjectNode();
    body.put("journal_id", credential.journalId());
    body.put("api_key", credential.apiKey());
    return body;
  }

  private static ObjectNode person(ObjectNode node, PersonRef person) {
    node.put("email", person.email());
    node.put("firstname", person.firstName());
    node.put("lastname", person.lastName());
    node.put("orcid_id", person.orcid().isEmpty() ? null : person.orcid());
    return node;
  }
}
