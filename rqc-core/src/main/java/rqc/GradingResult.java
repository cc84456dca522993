package rqc;

/**
 * Outcome of an interactive grading request.
 *
 * @param redirectUrl where the editor's browser should be sent next, or {@code null} when RQC
 *                    did not ask for a redirect
 * @param message     human-readable acknowledgement from RQC, may be {@code null}
 */
public record GradingResult(String redirectUrl, String message) {

  public boolean hasRedirect() {
    return redirectUrl != null && !redirectUrl.isEmpty();
  }
}
