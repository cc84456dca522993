package rqc.model;

import java.time.Instant;
import java.util.Objects;

/**
 * RQC credentials of one host journal.
 *
 * @param journalId   the RQC journal id
 * @param apiKey      the RQC journal key
 * @param validated   whether RQC has confirmed this key
 * @param validatedAt when the key was last confirmed, {@code null} if never
 */
public record JournalCredential(String journalId, String apiKey, boolean validated, Instant validatedAt) {

  public JournalCredential {
    Objects.requireNonNull(journalId, "journalId");
    Objects.requireNonNull(apiKey, "apiKey");
  }

  /** Credentials as entered by an administrator, not yet validated. */
  public static JournalCredential unvalidated(String journalId, String apiKey) {
    return new JournalCredential(journalId, apiKey, false, null);
  }

  @Override
  public String toString() {
    return "JournalCredential[journalId=" + journalId + ", validated=" + validated + "]";
  }
}
