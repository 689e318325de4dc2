package logfanout.jdbc.store;

import logfanout.jdbc.TableNames;
import logfanout.spi.ConnectionProvider;

import java.util.List;

/**
 * PostgreSQL target store.
 */
public final class PostgresTargetStore extends AbstractJdbcTargetStore {

  public PostgresTargetStore() {
    super();
  }

  public PostgresTargetStore(ConnectionProvider connectionProvider) {
    super(TableNames.DEFAULT_TABLE, connectionProvider);
  }

  public PostgresTargetStore(String tableName, ConnectionProvider connectionProvider) {
    super(tableName, connectionProvider);
  }

  @Override
  public AbstractJdbcTargetStore withConnectionProvider(ConnectionProvider connectionProvider,
      String tableName) {
    return new PostgresTargetStore(tableName, connectionProvider);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }
}
