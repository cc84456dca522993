package rqc.jdbc;

import rqc.model.JournalCredential;
import rqc.spi.CredentialStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC credential store. Keeps API keys and pseudonymization salts in separate tables so a
 * key rotation never touches the salt.
 */
public final class JdbcCredentialStore implements CredentialStore {

  private static final JdbcTemplate.RowMapper<JournalCredential> CREDENTIAL_ROW_MAPPER =
      rs -> new JournalCredential(
          rs.getString("journal_id"),
          rs.getString("api_key"),
          rs.getBoolean("validated"),
          JdbcTemplate.instant(rs, "validated_at"));

  private final String credentialTable;
  private final String saltTable;

  public JdbcCredentialStore() {
    this(TableNames.CREDENTIAL_TABLE, TableNames.SALT_TABLE);
  }

  public JdbcCredentialStore(String credentialTable, String saltTable) {
    this.credentialTable = TableNames.validate(credentialTable);
    this.saltTable = TableNames.validate(saltTable);
  }

  @Override
  public Optional<JournalCredential> find(Connection conn, String journalId) {
    List<JournalCredential> rows = JdbcTemplate.query(conn,
        "SELECT journal_id, api_key, validated, validated_at FROM " + credentialTable +
            " WHERE journal_id=?",
        CREDENTIAL_ROW_MAPPER, journalId);
    return rows.stream().findFirst();
  }

  @Override
  public void save(Connection conn, String journalId, String apiKey) {
    String updateSql = "UPDATE " + credentialTable +
        " SET api_key=?, validated=?, validated_at=NULL WHERE journal_id=?";
    if (JdbcTemplate.update(conn, updateSql, apiKey, false, journalId) > 0) {
      return;
    }
    boolean inserted = JdbcTemplate.insert(conn,
        "INSERT INTO " + credentialTable + " (journal_id, api_key, validated, validated_at) VALUES (?,?,?,NULL)",
        journalId, apiKey, false);
    if (!inserted) {
      // lost an insert race; the row exists now
      JdbcTemplate.update(conn, updateSql, apiKey, false, journalId);
    }
  }

  @Override
  public int markValidated(Connection conn, String journalId, String apiKey, Instant validatedAt) {
    return JdbcTemplate.update(conn,
        "UPDATE " + credentialTable + " SET validated=?, validated_at=? WHERE journal_id=? AND api_key=?",
        true, JdbcTemplate.timestamp(validatedAt), journalId, apiKey);
  }

  @Override
  public int markInvalid(Connection conn, String journalId) {
    return JdbcTemplate.update(conn,
        "UPDATE " + credentialTable + " SET validated=?, validated_at=NULL WHERE journal_id=?",
        false, journalId);
  }

  @Override
  public Optional<byte[]> findSalt(Connection conn, String journalId) {
    List<byte[]> rows = JdbcTemplate.query(conn,
        "SELECT salt FROM " + saltTable + " WHERE journal_id=?",
        rs -> rs.getBytes("salt"), journalId);
    return rows.stream().findFirst();
  }

  @Override
  public boolean insertSaltIfAbsent(Connection conn, String journalId, byte[] salt) {
    return JdbcTemplate.insert(conn,
        "INSERT INTO " + saltTable + " (journal_id, salt) VALUES (?,?)", journalId, salt);
  }
}
