package rqc.delivery;

import rqc.RqcException;

public class CredentialInvalidException extends RqcException {
  private final String journalId;

  public CredentialInvalidException(String journalId, String message) {
    super(message);
    this.journalId = journalId;
  }

  public String journalId() {
    return journalId;
  }
}
