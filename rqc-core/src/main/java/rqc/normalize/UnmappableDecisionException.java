package rqc.normalize;

import rqc.RqcException;

/**
 * The host decision code is outside the known set and cannot be reported.
 */
public class UnmappableDecisionException extends RqcException {
  private final String decisionCode;

  public UnmappableDecisionException(String decisionCode) {
    super("Unknown editorial decision: " + decisionCode);
    this.decisionCode = decisionCode;
  }

  public String decisionCode() {
    return decisionCode;
  }
}
