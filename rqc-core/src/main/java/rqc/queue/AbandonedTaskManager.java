package rqc.queue;

import rqc.model.DeliveryTask;
import rqc.spi.ConnectionProvider;
import rqc.spi.DeliveryTaskStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for abandoned tasks, which are kept for audit until discarded.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}.
 *
 * @see DeliveryTaskStore#queryAbandoned
 * @see DeliveryTaskStore#deleteAbandoned
 */
public final class AbandonedTaskManager {
  private static final Logger logger = Logger.getLogger(AbandonedTaskManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryTaskStore taskStore;

  public AbandonedTaskManager(ConnectionProvider connectionProvider, DeliveryTaskStore taskStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.taskStore = Objects.requireNonNull(taskStore, "taskStore");
  }

  /**
   * Queries abandoned tasks.
   *
   * @param journalId optional journal filter ({@code null} for all)
   * @param limit     maximum number of tasks to return
   * @return abandoned tasks, oldest first
   */
  public List<DeliveryTask> query(String journalId, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return taskStore.queryAbandoned(conn, journalId, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query abandoned tasks", e);
      return List.of();
    }
  }

  public int count(String journalId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return taskStore.countAbandoned(conn, journalId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count abandoned tasks", e);
      return 0;
    }
  }

  /**
   * Deletes an abandoned task once an operator has dealt with it.
   *
   * @return {@code true} if deleted, {@code false} if not found or not abandoned
   */
  public boolean discard(String taskId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return taskStore.deleteAbandoned(conn, taskId) > 0;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to discard abandoned task: " + taskId, e);
      return false;
    }
  }
}
