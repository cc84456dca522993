package rqc.spi;

import rqc.model.ConsentRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for reviewer consent, keyed by reviewer, journal and grading year.
 */
public interface ConsentStore {

  Optional<ConsentRecord> find(Connection conn, String reviewerId, String journalId, int gradingYear);

  /**
   * Inserts the record unless one already exists for its key.
   *
   * @return {@code true} if this call inserted the record
   */
  boolean insertIfAbsent(Connection conn, ConsentRecord record);

  /**
   * Records an answer on a record that has not been answered yet ({@code asked=false}).
   *
   * @return rows updated; 0 if the record was already answered or does not exist
   */
  int recordAnswer(Connection conn, String reviewerId, String journalId, int gradingYear,
      boolean optedIn, Instant answeredAt);
}
