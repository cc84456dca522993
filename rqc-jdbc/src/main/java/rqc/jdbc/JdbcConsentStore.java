package rqc.jdbc;

import rqc.model.ConsentRecord;
import rqc.spi.ConsentStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC consent store keyed by reviewer, journal and grading year.
 */
public final class JdbcConsentStore implements ConsentStore {

  private static final JdbcTemplate.RowMapper<ConsentRecord> CONSENT_ROW_MAPPER = rs -> new ConsentRecord(
      rs.getString("reviewer_id"),
      rs.getString("journal_id"),
      rs.getInt("grading_year"),
      rs.getBoolean("asked"),
      rs.getBoolean("opted_in"),
      JdbcTemplate.instant(rs, "answered_at"));

  private final String tableName;

  public JdbcConsentStore() {
    this(TableNames.CONSENT_TABLE);
  }

  public JdbcConsentStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public Optional<ConsentRecord> find(Connection conn, String reviewerId, String journalId, int gradingYear) {
    List<ConsentRecord> rows = JdbcTemplate.query(conn,
        "SELECT reviewer_id, journal_id, grading_year, asked, opted_in, answered_at FROM " + tableName +
            " WHERE reviewer_id=? AND journal_id=? AND grading_year=?",
        CONSENT_ROW_MAPPER, reviewerId, journalId, gradingYear);
    return rows.stream().findFirst();
  }

  @Override
  public boolean insertIfAbsent(Connection conn, ConsentRecord record) {
    return JdbcTemplate.insert(conn,
        "INSERT INTO " + tableName +
            " (reviewer_id, journal_id, grading_year, asked, opted_in, answered_at) VALUES (?,?,?,?,?,?)",
        record.reviewerId(), record.journalId(), record.gradingYear(),
        record.asked(), record.optedIn(), JdbcTemplate.timestamp(record.answeredAt()));
  }

  @Override
  public int recordAnswer(Connection conn, String reviewerId, String journalId, int gradingYear,
      boolean optedIn, Instant answeredAt) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET asked=?, opted_in=?, answered_at=?" +
            " WHERE reviewer_id=? AND journal_id=? AND grading_year=? AND asked=?",
        true, optedIn, JdbcTemplate.timestamp(answeredAt), reviewerId, journalId, gradingYear, false);
  }
}
