package rqc.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC delivery task stores with auto-detection support.
 *
 * <p>Task stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/rqc.jdbc.store.AbstractJdbcDeliveryTaskStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcDeliveryTaskStore store = JdbcDeliveryTaskStores.detect(dataSource);
 * AbstractJdbcDeliveryTaskStore pg = JdbcDeliveryTaskStores.get("postgresql");
 * }</pre>
 */
public final class JdbcDeliveryTaskStores {

  private static final List<AbstractJdbcDeliveryTaskStore> STORES;
  private static final Map<String, AbstractJdbcDeliveryTaskStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcDeliveryTaskStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcDeliveryTaskStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcDeliveryTaskStores() {
  }

  /**
   * Returns all registered task stores.
   */
  public static List<AbstractJdbcDeliveryTaskStore> all() {
    return STORES;
  }

  /**
   * Gets a task store by name.
   *
   * @param name task store name (case-insensitive)
   * @throws IllegalArgumentException if no task store has that name
   */
  public static AbstractJdbcDeliveryTaskStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcDeliveryTaskStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown task store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the task store from a DataSource's JDBC URL.
   *
   * @throws IllegalStateException if the URL cannot be read
   */
  public static AbstractJdbcDeliveryTaskStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect task store from DataSource", e);
    }
  }

  /**
   * Auto-detects the task store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no registered store handles the URL
   */
  public static AbstractJdbcDeliveryTaskStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase();
    for (AbstractJdbcDeliveryTaskStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No task store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
