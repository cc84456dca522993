package rqc.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Creates the adapter's tables from the bundled {@code rqc/schema/<dialect>.sql} scripts.
 * Every statement is {@code CREATE ... IF NOT EXISTS}, so running it twice is harmless.
 */
public final class RqcSchema {

  private RqcSchema() {}

  /**
   * @param dialect task store name, e.g. {@code h2}, {@code mysql} or {@code postgresql}
   */
  public static void create(Connection conn, String dialect) throws SQLException {
    for (String statement : statements(dialect)) {
      try (Statement st = conn.createStatement()) {
        st.execute(statement);
      }
    }
  }

  static List<String> statements(String dialect) {
    Objects.requireNonNull(dialect, "dialect");
    String resource = "rqc/schema/" + dialect.toLowerCase() + ".sql";
    try (InputStream in = RqcSchema.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema script for dialect: " + dialect);
      }
      String script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      return Arrays.stream(script.split(";"))
          .map(String::trim)
          .filter(s -> !s.isEmpty())
          .toList();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + resource, e);
    }
  }
}
