package logfanout.jdbc.store;

import logfanout.jdbc.TableNames;
import logfanout.spi.ConnectionProvider;

import java.sql.SQLException;
import java.util.List;

/**
 * MySQL target store. Also handles MariaDB and TiDB URLs.
 *
 * <p>MySQL reports unique violations as SQLState {@code 23000} with vendor code
 * {@code 1062} rather than {@code 23505}.
 */
public final class MySqlTargetStore extends AbstractJdbcTargetStore {
  private static final int ER_DUP_ENTRY = 1062;

  public MySqlTargetStore() {
    super();
  }

  public MySqlTargetStore(ConnectionProvider connectionProvider) {
    super(TableNames.DEFAULT_TABLE, connectionProvider);
  }

  public MySqlTargetStore(String tableName, ConnectionProvider connectionProvider) {
    super(tableName, connectionProvider);
  }

  @Override
  public AbstractJdbcTargetStore withConnectionProvider(ConnectionProvider connectionProvider,
      String tableName) {
    return new MySqlTargetStore(tableName, connectionProvider);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }

  @Override
  protected boolean isDuplicateKey(SQLException e) {
    return e.getErrorCode() == ER_DUP_ENTRY || super.isDuplicateKey(e);
  }
}
