package rqc.jdbc.store;

import rqc.jdbc.JdbcTemplate;
import rqc.jdbc.TableNames;
import rqc.model.DeliveryTask;
import rqc.model.TaskState;
import rqc.spi.DeliveryTaskStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC delivery task store with standard SQL implementations.
 *
 * <p>The {@code outstanding_key} column carries the task key while a task is pending or in
 * flight and is set to {@code NULL} on abandonment; its unique index guarantees at most one
 * outstanding task per submission.
 *
 * <p>Subclasses override {@link #upsert} with a single-statement dialect upsert where the
 * database has one. Register custom implementations via
 * {@code META-INF/services/rqc.jdbc.store.AbstractJdbcDeliveryTaskStore}.
 *
 * @see JdbcDeliveryTaskStores
 */
public abstract class AbstractJdbcDeliveryTaskStore implements DeliveryTaskStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final int PENDING = TaskState.PENDING.code();
  protected static final int IN_FLIGHT = TaskState.IN_FLIGHT.code();
  protected static final int ABANDONED = TaskState.ABANDONED.code();

  protected static final String COLUMNS = "task_id, task_key, journal_id, submission_ref, payload, " +
      "revision, attempts, created_at, next_attempt_at, state, last_error, locked_by, locked_at, abandoned_at";

  protected static final String CLAIMABLE =
      "((state=" + PENDING + " AND next_attempt_at<=?) OR (state=" + IN_FLIGHT + " AND locked_at<?))";

  protected static final JdbcTemplate.RowMapper<DeliveryTask> TASK_ROW_MAPPER = rs -> new DeliveryTask(
      rs.getString("task_id"),
      rs.getString("task_key"),
      rs.getString("journal_id"),
      rs.getString("submission_ref"),
      rs.getString("payload"),
      rs.getLong("revision"),
      rs.getInt("attempts"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "next_attempt_at"),
      TaskState.fromCode(rs.getInt("state")),
      rs.getString("last_error"),
      rs.getString("locked_by"),
      JdbcTemplate.instant(rs, "locked_at"),
      JdbcTemplate.instant(rs, "abandoned_at"));

  private final String tableName;

  protected AbstractJdbcDeliveryTaskStore() {
    this(TableNames.TASK_TABLE);
  }

  protected AbstractJdbcDeliveryTaskStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this task store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this task store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect writing to another table.
   */
  public abstract AbstractJdbcDeliveryTaskStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  /**
   * Portable upsert: insert, and on a key conflict merge into the outstanding row. If that row
   * was delivered or abandoned in between, the insert is tried again.
   */
  @Override
  public void upsert(Connection conn, DeliveryTask task) {
    for (int i = 0; i < 3; i++) {
      if (insertIfAbsent(conn, task)) {
        return;
      }
      if (mergeInto(conn, task.taskKey(), task.payload()) > 0) {
        return;
      }
    }
    throw new IllegalStateException("Could not queue task " + task.taskKey() + " after repeated conflicts");
  }

  @Override
  public boolean insertIfAbsent(Connection conn, DeliveryTask task) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", outstanding_key) " +
        "VALUES (?,?,?,?,?,?,?,?,?,?,?,NULL,NULL,NULL,?)";
    return JdbcTemplate.insert(conn, sql, insertParams(task));
  }

  private int mergeInto(Connection conn, String taskKey, String payload) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName() + " SET payload=?, revision=revision+1 WHERE outstanding_key=?",
        payload, taskKey);
  }

  /**
   * Parameters for {@link #COLUMNS} up to {@code last_error}, followed by the outstanding key.
   */
  protected Object[] insertParams(DeliveryTask task) {
    return new Object[]{
        task.taskId(), task.taskKey(), task.journalId(), task.submissionRef(), task.payload(),
        task.revision(), task.attempts(), JdbcTemplate.timestamp(task.createdAt()),
        JdbcTemplate.timestamp(task.nextAttemptAt()), task.state().code(),
        truncateError(task.lastError()), task.taskKey()};
  }

  @Override
  public Optional<DeliveryTask> findOutstanding(Connection conn, String taskKey) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE outstanding_key=?";
    return JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER, taskKey).stream().findFirst();
  }

  @Override
  public List<DeliveryTask> findDue(Connection conn, Instant now, Instant lockExpiry, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE " + CLAIMABLE +
        " ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER,
        JdbcTemplate.timestamp(now), JdbcTemplate.timestamp(lockExpiry), limit);
  }

  @Override
  public int claim(Connection conn, String taskId, String ownerId, Instant now, Instant lockExpiry) {
    String sql = "UPDATE " + tableName() + " SET state=" + IN_FLIGHT + ", locked_by=?, locked_at=?" +
        " WHERE task_id=? AND " + CLAIMABLE;
    return JdbcTemplate.update(conn, sql, ownerId, JdbcTemplate.timestamp(now), taskId,
        JdbcTemplate.timestamp(now), JdbcTemplate.timestamp(lockExpiry));
  }

  @Override
  public int markDelivered(Connection conn, String taskId, long revision) {
    String sql = "DELETE FROM " + tableName() +
        " WHERE task_id=? AND revision=? AND state<>" + ABANDONED;
    return JdbcTemplate.update(conn, sql, taskId, revision);
  }

  @Override
  public int markRetry(Connection conn, String taskId, Instant nextAttemptAt, String error) {
    String sql = "UPDATE " + tableName() + " SET state=" + PENDING +
        ", attempts=attempts+1, next_attempt_at=?, last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE task_id=? AND state<>" + ABANDONED;
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(nextAttemptAt), truncateError(error), taskId);
  }

  @Override
  public int markDeferred(Connection conn, String taskId, Instant nextAttemptAt, String reason) {
    String sql = "UPDATE " + tableName() + " SET state=" + PENDING +
        ", next_attempt_at=?, last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE task_id=? AND state<>" + ABANDONED;
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(nextAttemptAt), truncateError(reason), taskId);
  }

  @Override
  public int markAbandoned(Connection conn, String taskId, String ownerId, int attempts,
      Instant abandonedAt, String error) {
    String sql = "UPDATE " + tableName() + " SET state=" + ABANDONED +
        ", outstanding_key=NULL, attempts=?, abandoned_at=?, last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE task_id=? AND state=" + IN_FLIGHT + " AND locked_by=?";
    return JdbcTemplate.update(conn, sql, attempts, JdbcTemplate.timestamp(abandonedAt),
        truncateError(error), taskId, ownerId);
  }

  @Override
  public List<DeliveryTask> queryAbandoned(Connection conn, String journalId, int limit) {
    if (journalId == null) {
      String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE state=" + ABANDONED +
          " ORDER BY abandoned_at, task_id LIMIT ?";
      return JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER, limit);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE state=" + ABANDONED +
        " AND journal_id=? ORDER BY abandoned_at, task_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER, journalId, limit);
  }

  @Override
  public int countAbandoned(Connection conn, String journalId) {
    if (journalId == null) {
      return JdbcTemplate.count(conn,
          "SELECT COUNT(*) FROM " + tableName() + " WHERE state=" + ABANDONED);
    }
    return JdbcTemplate.count(conn,
        "SELECT COUNT(*) FROM " + tableName() + " WHERE state=" + ABANDONED + " AND journal_id=?", journalId);
  }

  @Override
  public int deleteAbandoned(Connection conn, String taskId) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tableName() + " WHERE task_id=? AND state=" + ABANDONED, taskId);
  }

  @Override
  public int countOutstanding(Connection conn) {
    return JdbcTemplate.count(conn,
        "SELECT COUNT(*) FROM " + tableName() + " WHERE state<>" + ABANDONED);
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
