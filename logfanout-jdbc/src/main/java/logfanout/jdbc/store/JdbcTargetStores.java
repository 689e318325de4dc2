package logfanout.jdbc.store;

import logfanout.jdbc.DataSourceConnectionProvider;
import logfanout.jdbc.TableNames;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC target stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/logfanout.jdbc.store.AbstractJdbcTargetStore}. The registered
 * instances are unbound dialect templates; {@link #forDataSource} returns a store ready
 * for use.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Detect the dialect and bind it to the DataSource
 * TargetStore store = JdbcTargetStores.forDataSource(dataSource);
 *
 * // Dialect lookup only
 * AbstractJdbcTargetStore mysql = JdbcTargetStores.detect("jdbc:mysql://localhost/app");
 * AbstractJdbcTargetStore h2 = JdbcTargetStores.get("h2");
 * }</pre>
 */
public final class JdbcTargetStores {

  private static final List<AbstractJdbcTargetStore> STORES;
  private static final Map<String, AbstractJdbcTargetStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcTargetStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcTargetStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcTargetStores() {
  }

  /**
   * Returns all registered target store dialects.
   */
  public static List<AbstractJdbcTargetStore> all() {
    return STORES;
  }

  /**
   * Gets a target store dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @return the unbound store
   * @throws IllegalArgumentException if no store is registered under the name
   */
  public static AbstractJdbcTargetStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcTargetStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown target store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the dialect from a DataSource.
   *
   * @param dataSource the data source
   * @return the unbound store
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no store matches the JDBC URL
   */
  public static AbstractJdbcTargetStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect target store from DataSource", e);
    }
  }

  /**
   * Auto-detects the dialect from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return the unbound store
   * @throws IllegalArgumentException if no store matches
   */
  public static AbstractJdbcTargetStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase();
    for (AbstractJdbcTargetStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No target store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Detects the dialect of {@code dataSource} and binds it to the default table.
   *
   * @param dataSource the data source
   * @return a bound store
   */
  public static AbstractJdbcTargetStore forDataSource(DataSource dataSource) {
    return forDataSource(dataSource, TableNames.DEFAULT_TABLE);
  }

  /**
   * Detects the dialect of {@code dataSource} and binds it to {@code tableName}.
   *
   * @param dataSource the data source
   * @param tableName  table holding the targets
   * @return a bound store
   */
  public static AbstractJdbcTargetStore forDataSource(DataSource dataSource, String tableName) {
    Objects.requireNonNull(dataSource, "dataSource");
    AbstractJdbcTargetStore template = detect(dataSource);
    return template.withConnectionProvider(new DataSourceConnectionProvider(dataSource), tableName);
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
