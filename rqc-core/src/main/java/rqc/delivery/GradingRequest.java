package rqc.delivery;

import java.util.Objects;

/**
 * An editor's request to open RQC grading for a submission.
 *
 * @param submissionRef   the submission to grade
 * @param interactiveUser email of the editor pressing the button, may be {@code null}
 * @param returnUrl       page RQC should send the editor back to, may be {@code null}
 */
public record GradingRequest(String submissionRef, String interactiveUser, String returnUrl) {

  public GradingRequest {
    Objects.requireNonNull(submissionRef, "submissionRef");
  }
}
