package rqc.consent;

import rqc.RqcException;
import rqc.model.ConsentRecord;
import rqc.spi.ConnectionProvider;
import rqc.spi.ConsentStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;

/**
 * Reviewer consent per journal and grading year.
 *
 * <p>A reviewer is asked at most once per journal-year. A reviewer who answered in an earlier
 * year has no record for the current year and is asked again.
 */
public final class ConsentService {
  private final ConnectionProvider connectionProvider;
  private final ConsentStore consentStore;
  private final Clock clock;

  public ConsentService(ConnectionProvider connectionProvider, ConsentStore consentStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.consentStore = Objects.requireNonNull(consentStore, "consentStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the reviewer's consent record, creating an unasked one if none exists.
   * Concurrent callers converge on the same row.
   */
  public ConsentLookup getOrCreateConsent(String reviewerId, String journalId, int gradingYear) {
    try (Connection conn = connectionProvider.getConnection()) {
      ConsentRecord record = ensureRecord(conn, reviewerId, journalId, gradingYear);
      return new ConsentLookup(record, !record.asked());
    } catch (SQLException e) {
      throw new RqcException("Failed to load consent of reviewer " + reviewerId, e);
    }
  }

  /**
   * Records the reviewer's answer.
   *
   * @throws AlreadyAnsweredException if the question was already answered for this journal-year
   */
  public ConsentRecord recordAnswer(String reviewerId, String journalId, int gradingYear, boolean optedIn) {
    try (Connection conn = connectionProvider.getConnection()) {
      ensureRecord(conn, reviewerId, journalId, gradingYear);
      int updated = consentStore.recordAnswer(conn, reviewerId, journalId, gradingYear, optedIn, clock.instant());
      if (updated == 0) {
        throw new AlreadyAnsweredException(reviewerId, journalId, gradingYear);
      }
      return load(conn, reviewerId, journalId, gradingYear);
    } catch (SQLException e) {
      throw new RqcException("Failed to record consent of reviewer " + reviewerId, e);
    }
  }

  /**
   * Whether a review by this reviewer must be reported anonymously: always for one-click
   * (unauthenticated) access, otherwise unless the reviewer opted in.
   */
  public boolean isAnonymizationRequired(String reviewerId, String journalId, int gradingYear,
      boolean authenticated) {
    ConsentRecord record = getOrCreateConsent(reviewerId, journalId, gradingYear).record();
    return requiresAnonymization(record, authenticated);
  }

  /**
   * Anonymization rule applied to an already loaded record.
   */
  public static boolean requiresAnonymization(ConsentRecord record, boolean authenticated) {
    return !authenticated || record == null || !record.asked() || !record.optedIn();
  }

  private ConsentRecord ensureRecord(Connection conn, String reviewerId, String journalId, int gradingYear) {
    var existing = consentStore.find(conn, reviewerId, journalId, gradingYear);
    if (existing.isPresent()) {
      return existing.get();
    }
    consentStore.insertIfAbsent(conn, ConsentRecord.unasked(reviewerId, journalId, gradingYear));
    return load(conn, reviewerId, journalId, gradingYear);
  }

  private ConsentRecord load(Connection conn, String reviewerId, String journalId, int gradingYear) {
    return consentStore.find(conn, reviewerId, journalId, gradingYear)
        .orElseThrow(() -> new RqcException("Consent record of reviewer " + reviewerId
            + " vanished for journal " + journalId + " in " + gradingYear));
  }
}
