package rqc.spi;

import rqc.model.DeliveryRecord;

import java.sql.Connection;
import java.util.Optional;

public interface DeliveryRecordStore {

  Optional<DeliveryRecord> find(Connection conn, String journalId, String submissionRef);

  /**
   * Stores the record unless the submission already has one. The first record wins.
   *
   * @return {@code true} if this call inserted the record
   */
  boolean insertIfAbsent(Connection conn, DeliveryRecord record);
}
