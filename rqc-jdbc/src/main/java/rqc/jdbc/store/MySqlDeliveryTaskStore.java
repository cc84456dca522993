package rqc.jdbc.store;

import rqc.jdbc.JdbcTemplate;
import rqc.jdbc.RqcStoreException;
import rqc.model.DeliveryTask;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * MySQL task store. Also used for MariaDB and TiDB.
 *
 * <p>Merges into the outstanding task with {@code INSERT ... ON DUPLICATE KEY UPDATE} on the
 * unique {@code outstanding_key}.
 */
public final class MySqlDeliveryTaskStore extends AbstractJdbcDeliveryTaskStore {
  private static final int MAX_DEADLOCK_RETRIES = 3;

  public MySqlDeliveryTaskStore() {
    super();
  }

  public MySqlDeliveryTaskStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcDeliveryTaskStore withTableName(String tableName) {
    return new MySqlDeliveryTaskStore(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  /**
   * InnoDB may pick concurrent upserts of one key as deadlock victims; those are retried.
   */
  @Override
  public void upsert(Connection conn, DeliveryTask task) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", outstanding_key) " +
        "VALUES (?,?,?,?,?,?,?,?,?,?,?,NULL,NULL,NULL,?) " +
        "ON DUPLICATE KEY UPDATE payload=VALUES(payload), revision=revision+1";
    for (int attempt = 1; ; attempt++) {
      try {
        JdbcTemplate.update(conn, sql, insertParams(task));
        return;
      } catch (RqcStoreException e) {
        if (attempt >= MAX_DEADLOCK_RETRIES || !isDeadlock(e)) {
          throw e;
        }
      }
    }
  }

  private static boolean isDeadlock(RqcStoreException e) {
    return e.getCause() instanceof SQLException sql && "40001".equals(sql.getSQLState());
  }
}
