package rqc.delivery;

/**
 * RQC's answer to a grading request.
 *
 * @param ok          whether RQC accepted the request
 * @param redirectUrl where to send the editor, from the body or a 303 {@code Location} header
 * @param statusCode  HTTP status
 * @param message     detail from RQC, may be {@code null}
 */
public record GradingResponse(boolean ok, String redirectUrl, int statusCode, String message) {
}
