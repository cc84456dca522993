package rqc;

/**
 * Thrown when a journal has no usable credentials: none saved, malformed, or not yet validated.
 */
public class ConfigurationException extends RqcException {
  private final String journalId;

  public ConfigurationException(String journalId, String message) {
    super(message);
    this.journalId = journalId;
  }

  public String journalId() {
    return journalId;
  }
}
