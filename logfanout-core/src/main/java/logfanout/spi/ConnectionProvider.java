package logfanout.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the target store. Each call returns a connection the
 * caller closes.
 */
public interface ConnectionProvider {
  Connection getConnection() throws SQLException;
}
