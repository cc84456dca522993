package rqc.host;

import java.util.List;
import java.util.Locale;

/**
 * Editorial decisions as the host workflow names them.
 */
public enum HostDecisionKind {
  ACCEPT("accept"),
  CONDITIONAL_ACCEPT("conditional_accept"),
  MINOR_REVISIONS("minor_revisions"),
  MAJOR_REVISIONS("major_revisions"),
  REJECT("reject", "decline");

  private final List<String> codes;

  HostDecisionKind(String... codes) {
    this.codes = List.of(codes);
  }

  public List<String> codes() {
    return codes;
  }

  /**
   * Looks up a host decision code, ignoring case and surrounding whitespace.
   *
   * @return the matching kind, or {@code null} for codes outside the known set
   */
  public static HostDecisionKind fromCode(String code) {
    if (code == null) {
      return null;
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (HostDecisionKind kind : values()) {
      if (kind.codes.contains(normalized)) {
        return kind;
      }
    }
    return null;
  }
}
