package logfanout.jdbc.store;

import logfanout.jdbc.JdbcTemplate;
import logfanout.jdbc.TableNames;
import logfanout.jdbc.TargetStoreException;
import logfanout.spi.ConnectionProvider;
import logfanout.spi.TargetStore;
import logfanout.target.DuplicateTargetNameException;
import logfanout.target.TargetConfig;
import logfanout.target.TargetIds;
import logfanout.target.TargetNotFoundException;
import logfanout.target.TargetValidator;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.logging.Logger;

/**
 * Base JDBC target store with standard SQL implementations.
 *
 * <p>Instances loaded through {@link java.util.ServiceLoader} are unbound templates that
 * only describe a dialect; {@link #withConnectionProvider} returns a usable store. Register
 * custom implementations via
 * {@code META-INF/services/logfanout.jdbc.store.AbstractJdbcTargetStore}.
 *
 * <p>Empty strings and zero batch settings are written as SQL {@code NULL}; reads map
 * {@code NULL} back to empty strings and zero. Booleans are stored as {@code 0}/{@code 1}
 * and timestamps as epoch seconds.
 *
 * @see JdbcTargetStores
 */
public abstract class AbstractJdbcTargetStore implements TargetStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcTargetStore.class.getName());

  private static final String COLUMNS =
      "id, name, type, enabled, protocol, host, port, tag, format, " +
      "tls_enabled, tls_cert, tls_key, tls_ca, tls_skip_verify, " +
      "filter_level, auth_token, url, batch_size, flush_interval, " +
      "created_at, updated_at";

  protected static final JdbcTemplate.RowMapper<TargetConfig> TARGET_ROW_MAPPER = rs -> TargetConfig.builder()
      .id(rs.getString("id"))
      .name(rs.getString("name"))
      .type(rs.getString("type"))
      .enabled(JdbcTemplate.flag(rs, "enabled"))
      .protocol(rs.getString("protocol"))
      .host(rs.getString("host"))
      .port(rs.getInt("port"))
      .tag(rs.getString("tag"))
      .format(rs.getString("format"))
      .tlsEnabled(JdbcTemplate.flag(rs, "tls_enabled"))
      .tlsCert(rs.getString("tls_cert"))
      .tlsKey(rs.getString("tls_key"))
      .tlsCa(rs.getString("tls_ca"))
      .tlsSkipVerify(JdbcTemplate.flag(rs, "tls_skip_verify"))
      .filterLevel(rs.getString("filter_level"))
      .authToken(rs.getString("auth_token"))
      .url(rs.getString("url"))
      .batchSize(rs.getInt("batch_size"))
      .flushIntervalSeconds(rs.getInt("flush_interval"))
      .createdAt(JdbcTemplate.epochSeconds(rs, "created_at"))
      .updatedAt(JdbcTemplate.epochSeconds(rs, "updated_at"))
      .build();

  private final String tableName;
  private final ConnectionProvider connectionProvider;

  protected AbstractJdbcTargetStore() {
    this(TableNames.DEFAULT_TABLE, null);
  }

  protected AbstractJdbcTargetStore(String tableName, ConnectionProvider connectionProvider) {
    this.tableName = TableNames.validate(tableName);
    this.connectionProvider = connectionProvider;
  }

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect bound to {@code connectionProvider}.
   *
   * @param connectionProvider source of connections
   * @param tableName table holding the targets
   * @return a new bound store
   */
  public abstract AbstractJdbcTargetStore withConnectionProvider(
      ConnectionProvider connectionProvider, String tableName);

  /** Same as {@link #withConnectionProvider(ConnectionProvider, String)} on the default table. */
  public AbstractJdbcTargetStore withConnectionProvider(ConnectionProvider connectionProvider) {
    return withConnectionProvider(connectionProvider, TableNames.DEFAULT_TABLE);
  }

  public String tableName() {
    return tableName;
  }

  /** Whether this store has a connection provider and can run statements. */
  public boolean isBound() {
    return connectionProvider != null;
  }

  /**
   * Returns {@code true} if {@code e} reports a unique constraint violation.
   * Default: SQLState {@code 23505}.
   */
  protected boolean isDuplicateKey(SQLException e) {
    return "23505".equals(e.getSQLState());
  }

  @Override
  public List<TargetConfig> list() {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " ORDER BY name";
    return withConnection(conn -> JdbcTemplate.query(conn, sql, TARGET_ROW_MAPPER));
  }

  @Override
  public List<TargetConfig> listEnabled() {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE enabled = 1 ORDER BY name";
    return withConnection(conn -> JdbcTemplate.query(conn, sql, TARGET_ROW_MAPPER));
  }

  @Override
  public TargetConfig get(String id) {
    return withConnection(conn -> find(conn, id));
  }

  @Override
  public TargetConfig create(TargetConfig cfg) {
    Instant now = Instant.ofEpochSecond(Instant.now().getEpochSecond());
    TargetConfig stored = TargetIds.ensureId(cfg).toBuilder()
        .createdAt(now)
        .updatedAt(now)
        .build();
    TargetValidator.validate(stored);

    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") " +
        "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    withConnection(conn -> {
      try {
        return JdbcTemplate.update(conn, sql,
            stored.id(), stored.name(), stored.type(), stored.enabled(),
            stored.protocol(), stored.host(), stored.port(), stored.tag(), stored.format(),
            stored.tlsEnabled(), emptyToNull(stored.tlsCert()), emptyToNull(stored.tlsKey()),
            emptyToNull(stored.tlsCa()), stored.tlsSkipVerify(),
            stored.filterLevel(), emptyToNull(stored.authToken()), emptyToNull(stored.url()),
            zeroToNull(stored.batchSize()), zeroToNull(stored.flushIntervalSeconds()),
            now, now);
      } catch (TargetStoreException e) {
        throw translateDuplicate(e, stored.name());
      }
    });

    logger.info("Logging target created: id=" + stored.id() + ", name=" + stored.name()
        + ", type=" + stored.type());
    return stored;
  }

  @Override
  public TargetConfig update(TargetConfig cfg) {
    TargetValidator.validate(cfg);
    Instant now = Instant.now();

    String sql = "UPDATE " + tableName() + " SET " +
        "name = ?, type = ?, enabled = ?, protocol = ?, host = ?, port = ?, " +
        "tag = ?, format = ?, tls_enabled = ?, tls_cert = ?, tls_key = ?, " +
        "tls_ca = ?, tls_skip_verify = ?, filter_level = ?, " +
        "auth_token = ?, url = ?, batch_size = ?, flush_interval = ?, " +
        "updated_at = ? WHERE id = ?";
    TargetConfig stored = withConnection(conn -> {
      int rows;
      try {
        rows = JdbcTemplate.update(conn, sql,
            cfg.name(), cfg.type(), cfg.enabled(), cfg.protocol(), cfg.host(), cfg.port(),
            cfg.tag(), cfg.format(), cfg.tlsEnabled(), emptyToNull(cfg.tlsCert()),
            emptyToNull(cfg.tlsKey()), emptyToNull(cfg.tlsCa()), cfg.tlsSkipVerify(),
            cfg.filterLevel(), emptyToNull(cfg.authToken()), emptyToNull(cfg.url()),
            zeroToNull(cfg.batchSize()), zeroToNull(cfg.flushIntervalSeconds()),
            now, cfg.id());
      } catch (TargetStoreException e) {
        throw translateDuplicate(e, cfg.name());
      }
      if (rows == 0) {
        throw new TargetNotFoundException(cfg.id());
      }
      return find(conn, cfg.id());
    });

    logger.info("Logging target updated: id=" + stored.id() + ", name=" + stored.name());
    return stored;
  }

  @Override
  public void delete(String id) {
    String sql = "DELETE FROM " + tableName() + " WHERE id = ?";
    int rows = withConnection(conn -> JdbcTemplate.update(conn, sql, id));
    if (rows == 0) {
      throw new TargetNotFoundException(id);
    }
    logger.info("Logging target deleted: id=" + id);
  }

  private TargetConfig find(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id = ?";
    return JdbcTemplate.queryOne(conn, sql, TARGET_ROW_MAPPER, id)
        .orElseThrow(() -> new TargetNotFoundException(id));
  }

  private RuntimeException translateDuplicate(TargetStoreException e, String name) {
    if (e.getCause() instanceof SQLException sqlException && isDuplicateKey(sqlException)) {
      return new DuplicateTargetNameException(name, sqlException);
    }
    return e;
  }

  private <T> T withConnection(ConnectionCallback<T> callback) {
    if (connectionProvider == null) {
      throw new IllegalStateException(
          "Target store '" + name() + "' has no connection provider; use withConnectionProvider()");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.doInConnection(conn);
    } catch (SQLException e) {
      throw new TargetStoreException("Failed to obtain connection", e);
    }
  }

  private static String emptyToNull(String value) {
    return value.isEmpty() ? null : value;
  }

  private static Integer zeroToNull(int value) {
    return value == 0 ? null : value;
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T doInConnection(Connection conn);
  }
}
