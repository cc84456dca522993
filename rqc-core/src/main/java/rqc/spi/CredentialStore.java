package rqc.spi;

import rqc.model.JournalCredential;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for journal credentials and the per-journal anonymization salt.
 */
public interface CredentialStore {

  Optional<JournalCredential> find(Connection conn, String journalId);

  /**
   * Inserts or replaces the credentials of a journal. The stored row is always unvalidated
   * afterwards.
   */
  void save(Connection conn, String journalId, String apiKey);

  /**
   * Marks the credentials validated, but only if the stored key still equals {@code apiKey}.
   *
   * @return rows updated
   */
  int markValidated(Connection conn, String journalId, String apiKey, Instant validatedAt);

  /**
   * Marks the credentials of a journal unvalidated.
   *
   * @return rows updated
   */
  int markInvalid(Connection conn, String journalId);

  Optional<byte[]> findSalt(Connection conn, String journalId);

  /**
   * Inserts a salt unless one already exists.
   *
   * @return {@code true} if this call inserted the salt
   */
  boolean insertSaltIfAbsent(Connection conn, String journalId, byte[] salt);
}
