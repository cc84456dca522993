package rqc.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

final class H2Databases {
  private H2Databases() {}

  static JdbcDataSource fresh() throws SQLException {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:rqc_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection()) {
      RqcSchema.create(conn, "h2");
    }
    return dataSource;
  }
}
