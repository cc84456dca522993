package rqc;

/**
 * Result of reporting an editorial decision. Decision-time reporting never throws to the
 * editor; every path ends in one of these values.
 */
public enum ReportStatus {
  /** Accepted by RQC on the first attempt. */
  DELIVERED,
  /** Delivery failed transiently (or the submission was busy); a retry task holds the payload. */
  QUEUED,
  /** A retry task was already outstanding; its payload was replaced with this decision. */
  MERGED_INTO_PENDING,
  /** RQC rejected the journal credentials; the credential is now marked unvalidated. */
  CREDENTIAL_INVALID,
  /** RQC rejected the payload itself. Not retried. */
  REJECTED,
  /** The journal has no validated credentials. Nothing was sent. */
  NOT_CONFIGURED,
  /** The host decision could not be translated. Nothing was sent. */
  MAPPING_FAILED
}
