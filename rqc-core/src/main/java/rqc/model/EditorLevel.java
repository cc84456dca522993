package rqc.model;

/**
 * Editor seniority levels in the RQC taxonomy.
 *
 * <p>Level 2 exists in the taxonomy but has no counterpart in the host roles and is never
 * produced by the normalizer.
 */
public enum EditorLevel {
  SECTION_EDITOR(1),
  HANDLING_EDITOR(2),
  EDITOR(3);

  private final int code;

  EditorLevel(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
