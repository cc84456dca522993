package rqc.spi;

import rqc.RqcException;
import rqc.model.DeliveryTask;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives failures that need an operator's attention. Decision-time reporting never throws
 * to the editor, so this is where such failures surface.
 *
 * <p>The {@link #LOGGING} instance writes every notification to {@code java.util.logging}
 * at {@link Level#SEVERE}.
 */
public interface OperatorNotifier {

  OperatorNotifier LOGGING = new Logging();

  /**
   * A queued report exhausted its attempts or age, or was rejected while draining.
   * Called exactly once per abandoned task.
   */
  void onAbandoned(DeliveryTask task, RqcException reason);

  /**
   * RQC refused a journal's credentials. Further reports for the journal are blocked until
   * the credentials are validated again.
   */
  void onCredentialInvalid(String journalId, String detail);

  /**
   * RQC refused a decision report outright.
   */
  void onPermanentReject(String journalId, String submissionRef, String detail);

  /**
   * A host decision could not be translated into the RQC taxonomy.
   */
  void onMappingFailed(String journalId, String submissionRef, RqcException error);

  /**
   * A decision arrived for a journal without usable credentials.
   */
  void onConfigurationError(String journalId, String detail);

  /**
   * Logs every notification at SEVERE.
   */
  final class Logging implements OperatorNotifier {
    private static final Logger logger = Logger.getLogger(OperatorNotifier.class.getName());

    @Override
    public void onAbandoned(DeliveryTask task, RqcException reason) {
      logger.log(Level.SEVERE, "Abandoned RQC delivery task " + task.taskId()
          + " for submission " + task.submissionRef() + " of journal " + task.journalId()
          + " after " + task.attempts() + " attempt(s)", reason);
    }

    @Override
    public void onCredentialInvalid(String journalId, String detail) {
      logger.log(Level.SEVERE, "RQC rejected the credentials of journal {0}: {1}",
          new Object[]{journalId, detail});
    }

    @Override
    public void onPermanentReject(String journalId, String submissionRef, String detail) {
      logger.log(Level.SEVERE, "RQC rejected the decision report for submission {0} of journal {1}: {2}",
          new Object[]{submissionRef, journalId, detail});
    }

    @Override
    public void onMappingFailed(String journalId, String submissionRef, RqcException error) {
      logger.log(Level.SEVERE, "Cannot map decision for submission " + submissionRef
          + " of journal " + journalId, error);
    }

    @Override
    public void onConfigurationError(String journalId, String detail) {
      logger.log(Level.SEVERE, "RQC is not configured for journal {0}: {1}",
          new Object[]{journalId, detail});
    }
  }
}
