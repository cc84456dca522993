package rqc.delivery;

import rqc.RqcException;

/**
 * Classified result of one decision report attempt.
 *
 * <ul>
 *   <li>{@link Delivered}: RQC accepted the report.</li>
 *   <li>{@link TransientFailure}: worth retrying later.</li>
 *   <li>{@link CredentialInvalid}: the journal credentials were refused; retrying cannot help
 *       until an administrator fixes them.</li>
 *   <li>{@link PermanentReject}: the report itself was refused.</li>
 * </ul>
 */
public sealed interface DeliveryOutcome permits DeliveryOutcome.Delivered,
    DeliveryOutcome.TransientFailure, DeliveryOutcome.CredentialInvalid, DeliveryOutcome.PermanentReject {

  /** Human-readable description for logs and the task's {@code lastError}. */
  String describe();

  /** Exception equivalent of a failed outcome; {@code null} for {@link Delivered}. */
  RqcException toException();

  record Delivered(int statusCode) implements DeliveryOutcome {
    @Override
    public String describe() {
      return "HTTP " + statusCode;
    }

    @Override
    public RqcException toException() {
      return null;
    }
  }

  /**
   * @param statusCode HTTP status, or 0 when no response was received
   */
  record TransientFailure(int statusCode, String reason) implements DeliveryOutcome {
    @Override
    public String describe() {
      return statusCode == 0 ? reason : "HTTP " + statusCode + ": " + reason;
    }

    @Override
    public RqcException toException() {
      return new TransientDeliveryException(describe());
    }
  }

  record CredentialInvalid(String journalId, int statusCode, String reason) implements DeliveryOutcome {
    @Override
    public String describe() {
      return "HTTP " + statusCode + ": " + reason;
    }

    @Override
    public RqcException toException() {
      return new CredentialInvalidException(journalId, describe());
    }
  }

  record PermanentReject(int statusCode, String reason) implements DeliveryOutcome {
    @Override
    public String describe() {
      return "HTTP " + statusCode + ": " + reason;
    }

    @Override
    public RqcException toException() {
      return new PermanentRejectException(statusCode, describe());
    }
  }
}
