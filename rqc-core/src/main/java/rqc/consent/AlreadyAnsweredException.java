package rqc.consent;

import rqc.RqcException;

/**
 * The consent question for this reviewer, journal and year has already been answered.
 */
public class AlreadyAnsweredException extends RqcException {

  public AlreadyAnsweredException(String reviewerId, String journalId, int gradingYear) {
    super("Reviewer " + reviewerId + " already answered the RQC consent question for journal "
        + journalId + " in " + gradingYear);
  }
}
