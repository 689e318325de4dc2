package logfanout.jdbc;

import java.util.Objects;

/**
 * Table name validation for the JDBC target store. Names are spliced into SQL, so
 * only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "logging_targets";
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
