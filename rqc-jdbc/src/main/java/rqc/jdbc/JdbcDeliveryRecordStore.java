package rqc.jdbc;

import rqc.codec.PayloadCodec;
import rqc.model.DeliveryRecord;
import rqc.spi.DeliveryRecordStore;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC store for first-delivery records. The editor set is kept as JSON.
 */
public final class JdbcDeliveryRecordStore implements DeliveryRecordStore {
  private final String tableName;
  private final PayloadCodec codec;

  public JdbcDeliveryRecordStore() {
    this(TableNames.DELIVERY_RECORD_TABLE, PayloadCodec.getDefault());
  }

  public JdbcDeliveryRecordStore(String tableName, PayloadCodec codec) {
    this.tableName = TableNames.validate(tableName);
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public Optional<DeliveryRecord> find(Connection conn, String journalId, String submissionRef) {
    List<DeliveryRecord> rows = JdbcTemplate.query(conn,
        "SELECT journal_id, submission_ref, editors, first_delivered_at FROM " + tableName +
            " WHERE journal_id=? AND submission_ref=?",
        rs -> new DeliveryRecord(
            rs.getString("journal_id"),
            rs.getString("submission_ref"),
            codec.decodeEditors(rs.getString("editors")),
            JdbcTemplate.instant(rs, "first_delivered_at")),
        journalId, submissionRef);
    return rows.stream().findFirst();
  }

  @Override
  public boolean insertIfAbsent(Connection conn, DeliveryRecord record) {
    return JdbcTemplate.insert(conn,
        "INSERT INTO " + tableName + " (journal_id, submission_ref, editors, first_delivered_at) VALUES (?,?,?,?)",
        record.journalId(), record.submissionRef(), codec.encodeEditors(record.editors()),
        JdbcTemplate.timestamp(record.firstDeliveredAt()));
  }
}
