package rqc.host;

/**
 * How a host user relates to a submission's editorial handling.
 */
public enum HostEditorRole {
  /** Section editor assigned to the submission. */
  SECTION_EDITOR,
  /** Section editor named on a decision draft. */
  DRAFT_SECTION_EDITOR,
  /** Editor assigned to the submission. */
  EDITOR,
  /** Editor who authored, or is attributed to, the decision. */
  DECISION_AUTHOR
}
