package rqc.model;

/**
 * Decision categories understood by RQC.
 */
public enum DecisionKind {
  ACCEPT("ACCEPT"),
  MINOR_REVISION("MINORREVISION"),
  MAJOR_REVISION("MAJORREVISION"),
  REJECT("REJECT");

  private final String wireName;

  DecisionKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
