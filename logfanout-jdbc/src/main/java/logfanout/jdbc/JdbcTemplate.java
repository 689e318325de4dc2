package logfanout.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statement helper for the target stores.
 *
 * <p>Parameters are bound by Java type to the column conventions of the target table:
 * {@link Boolean} as a 0/1 flag, {@link Instant} as epoch seconds and {@code null} as
 * SQL NULL. {@link SQLException}s are rethrown as {@link TargetStoreException} naming
 * the statement, with the original as cause.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /**
   * Executes an INSERT, UPDATE or DELETE.
   *
   * @return rows affected
   */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new TargetStoreException("Failed to execute " + describe(sql), e);
    }
  }

  /** Executes a SELECT and maps every row. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bind(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new TargetStoreException("Failed to execute " + describe(sql), e);
    }
  }

  /** Executes a SELECT by key and maps the first row, if any. */
  public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper,
      Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Reads a 0/1 flag column; NULL reads as false. */
  public static boolean flag(ResultSet rs, String column) throws SQLException {
    return rs.getInt(column) == 1;
  }

  /** Reads an epoch-seconds column; NULL reads as the epoch. */
  public static Instant epochSeconds(ResultSet rs, String column) throws SQLException {
    return Instant.ofEpochSecond(rs.getLong(column));
  }

  static void bind(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      int index = i + 1;
      Object param = params[i];
      if (param == null) {
        ps.setNull(index, Types.NULL);
      } else if (param instanceof String s) {
        ps.setString(index, s);
      } else if (param instanceof Boolean b) {
        ps.setInt(index, b ? 1 : 0);
      } else if (param instanceof Integer n) {
        ps.setInt(index, n);
      } else if (param instanceof Long n) {
        ps.setLong(index, n);
      } else if (param instanceof Instant t) {
        ps.setLong(index, t.getEpochSecond());
      } else {
        throw new IllegalArgumentException(
            "Unsupported parameter type at index " + index + ": " + param.getClass().getName());
      }
    }
  }

  // "INSERT INTO logging_targets (...)" -> "insert on logging_targets"
  private static String describe(String sql) {
    String[] words = sql.trim().split("\\s+");
    String verb = words[0].toLowerCase();
    String table = null;
    for (int i = 0; i < words.length - 1; i++) {
      String word = words[i].toUpperCase();
      if (word.equals("INTO") || word.equals("FROM") || word.equals("UPDATE")) {
        table = words[i + 1];
        break;
      }
    }
    return table == null ? verb : verb + " on " + table;
  }

  private JdbcTemplate() {}
}
