package rqc.delivery;

import java.util.Set;

/**
 * Maps RQC responses onto {@link DeliveryOutcome}s.
 *
 * <p>2xx and 303 deliver; 401 and 403 mean bad credentials; 408, 425, 429 and every 5xx are
 * transient; everything else is a permanent rejection. Failures without a response (connection
 * refused, timeouts) are transient.
 */
public final class OutcomeClassifier {
  private static final Set<Integer> TRANSIENT_4XX = Set.of(408, 425, 429);

  private OutcomeClassifier() {}

  public static DeliveryOutcome classify(String journalId, int statusCode, String message) {
    String reason = message == null || message.isBlank() ? "no detail" : message;
    if (isSuccess(statusCode)) {
      return new DeliveryOutcome.Delivered(statusCode);
    }
    if (statusCode == 401 || statusCode == 403) {
      return new DeliveryOutcome.CredentialInvalid(journalId, statusCode, reason);
    }
    if (isTransient(statusCode)) {
      return new DeliveryOutcome.TransientFailure(statusCode, reason);
    }
    return new DeliveryOutcome.PermanentReject(statusCode, reason);
  }

  /** Outcome for an attempt that produced no HTTP response at all. */
  public static DeliveryOutcome noResponse(Throwable cause) {
    String reason = cause.getClass().getSimpleName()
        + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
    return new DeliveryOutcome.TransientFailure(0, reason);
  }

  public static boolean isSuccess(int statusCode) {
    return (statusCode >= 200 && statusCode < 300) || statusCode == 303;
  }

  public static boolean isTransient(int statusCode) {
    return statusCode >= 500 || TRANSIENT_4XX.contains(statusCode);
  }
}
