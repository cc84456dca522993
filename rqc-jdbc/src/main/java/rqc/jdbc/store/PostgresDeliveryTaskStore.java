package rqc.jdbc.store;

import rqc.jdbc.JdbcTemplate;
import rqc.model.DeliveryTask;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL task store.
 *
 * <p>Merges into the outstanding task with {@code INSERT ... ON CONFLICT (outstanding_key)
 * DO UPDATE} in a single round-trip.
 */
public final class PostgresDeliveryTaskStore extends AbstractJdbcDeliveryTaskStore {

  public PostgresDeliveryTaskStore() {
    super();
  }

  public PostgresDeliveryTaskStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcDeliveryTaskStore withTableName(String tableName) {
    return new PostgresDeliveryTaskStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public void upsert(Connection conn, DeliveryTask task) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", outstanding_key) " +
        "VALUES (?,?,?,?,?,?,?,?,?,?,?,NULL,NULL,NULL,?) " +
        "ON CONFLICT (outstanding_key) DO UPDATE SET payload=EXCLUDED.payload, " +
        "revision=" + tableName() + ".revision+1";
    JdbcTemplate.update(conn, sql, insertParams(task));
  }
}
