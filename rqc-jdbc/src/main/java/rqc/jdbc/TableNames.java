package rqc.jdbc;

import java.util.Objects;

/**
 * Default table names and table name validation for the JDBC stores.
 */
public final class TableNames {
  public static final String CREDENTIAL_TABLE = "rqc_journal_credential";
  public static final String SALT_TABLE = "rqc_journal_salt";
  public static final String CONSENT_TABLE = "rqc_reviewer_consent";
  public static final String DELIVERY_RECORD_TABLE = "rqc_delivery_record";
  public static final String TASK_TABLE = "rqc_delivery_task";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
