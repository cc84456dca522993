package rqc.delivery;

import rqc.model.DecisionEvent;
import rqc.model.JournalCredential;

/**
 * A single synchronous attempt against the RQC service. Implementations never retry.
 *
 * @see OutcomeClassifier
 */
public interface DeliveryClient {

  /**
   * Asks RQC whether the credentials are valid.
   *
   * @return the verdict; a refusal is a normal result, not an exception
   * @throws TransientDeliveryException if RQC could not be reached or answered with a transient error
   */
  CredentialCheck validateCredentials(JournalCredential credential);

  /**
   * Requests grading for a submission on behalf of an editor. Interactive; never queued.
   *
   * @throws TransientDeliveryException   if RQC could not be reached or is temporarily failing
   * @throws CredentialInvalidException   if RQC refused the credentials
   * @throws PermanentRejectException     if RQC refused the request
   */
  GradingResponse triggerGrading(JournalCredential credential, GradingRequest request);

  /**
   * Sends one decision report.
   *
   * @return the classified outcome; transport errors are reported as
   *     {@link DeliveryOutcome.TransientFailure}, never thrown
   */
  DeliveryOutcome reportDecision(JournalCredential credential, DecisionEvent event);
}
