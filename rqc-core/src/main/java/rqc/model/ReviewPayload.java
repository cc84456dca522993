package rqc.model;

import java.time.Instant;

/**
 * One review as reported to RQC.
 *
 * <p>When {@code anonymous} is set, {@code reviewer} carries only a pseudonymous token and
 * no name or ORCID.
 *
 * @param visibleId         1-based number of the review within the submission
 * @param reviewer          identity or pseudonym of the reviewer
 * @param anonymous         whether identity was withheld
 * @param content           review text, empty when withheld
 * @param invitedAt         when the reviewer was invited
 * @param agreedAt          when the reviewer accepted the invitation
 * @param expectedAt        due date
 * @param submittedAt       when the review was completed
 * @param suggestedDecision the reviewer's recommendation, {@code null} if none was given
 */
public record ReviewPayload(
    int visibleId,
    PersonRef reviewer,
    boolean anonymous,
    String content,
    Instant invitedAt,
    Instant agreedAt,
    Instant expectedAt,
    Instant submittedAt,
    DecisionKind suggestedDecision) {
}
