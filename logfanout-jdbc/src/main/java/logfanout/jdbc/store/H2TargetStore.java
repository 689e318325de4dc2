package logfanout.jdbc.store;

import logfanout.jdbc.TableNames;
import logfanout.spi.ConnectionProvider;

import java.util.List;

/**
 * H2 target store. Primarily for tests and embedded deployments.
 */
public final class H2TargetStore extends AbstractJdbcTargetStore {

  public H2TargetStore() {
    super();
  }

  public H2TargetStore(ConnectionProvider connectionProvider) {
    super(TableNames.DEFAULT_TABLE, connectionProvider);
  }

  public H2TargetStore(String tableName, ConnectionProvider connectionProvider) {
    super(tableName, connectionProvider);
  }

  @Override
  public AbstractJdbcTargetStore withConnectionProvider(ConnectionProvider connectionProvider,
      String tableName) {
    return new H2TargetStore(tableName, connectionProvider);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
