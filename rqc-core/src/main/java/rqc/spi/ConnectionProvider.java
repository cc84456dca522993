package rqc.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for the adapter's stores.
 *
 * <p>Callers are responsible for closing the returned connection. Every store operation runs
 * as its own statement; the adapter never spans a transaction across calls.
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
