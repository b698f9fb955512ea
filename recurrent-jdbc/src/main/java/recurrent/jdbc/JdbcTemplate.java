package recurrent.jdbc;

import recurrent.CancellationToken;
import recurrent.RecurrentStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Static JDBC helpers shared by the purgers, locks and the recurring job store.
 *
 * <p>Parameters are bound positionally. {@link Instant} values are bound as
 * {@link Timestamp}s; every {@link SQLException} surfaces as a
 * {@link RecurrentStoreException} carrying the failed statement.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Runs an INSERT, UPDATE or DELETE and returns the affected row count. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw failure(sql, e);
    }
  }

  /**
   * Like {@link #update(Connection, String, Object...)} but with no query
   * timeout; the statement is cancelled from another thread once {@code token}
   * is cancelled. The resulting {@link SQLException} is left to the caller to
   * classify, wrapped as the cause of the thrown exception.
   */
  public static int update(Connection conn, CancellationToken token, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      ps.setQueryTimeout(0);
      try (CancellationToken.Registration ignored = token.register(() -> cancel(ps))) {
        return ps.executeUpdate();
      }
    } catch (SQLException e) {
      throw failure(sql, e);
    }
  }

  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params);
         ResultSet rs = ps.executeQuery()) {
      List<T> rows = new ArrayList<>();
      while (rs.next()) {
        rows.add(mapper.map(rs));
      }
      return rows;
    } catch (SQLException e) {
      throw failure(sql, e);
    }
  }

  /** First mapped row, empty when the query returns none or maps to {@code null}. */
  public static <T> Optional<T> queryFirst(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params);
         ResultSet rs = ps.executeQuery()) {
      return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
    } catch (SQLException e) {
      throw failure(sql, e);
    }
  }

  private static PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      for (int i = 0; i < params.length; i++) {
        bind(ps, i + 1, params[i]);
      }
      return ps;
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
  }

  private static void bind(PreparedStatement ps, int index, Object param) throws SQLException {
    if (param == null) {
      ps.setObject(index, null);
    } else if (param instanceof String s) {
      ps.setString(index, s);
    } else if (param instanceof Integer n) {
      ps.setInt(index, n);
    } else if (param instanceof Long n) {
      ps.setLong(index, n);
    } else if (param instanceof Instant instant) {
      ps.setTimestamp(index, Timestamp.from(instant));
    } else if (param instanceof Timestamp ts) {
      ps.setTimestamp(index, ts);
    } else {
      ps.setObject(index, param);
    }
  }

  private static void cancel(PreparedStatement ps) {
    try {
      ps.cancel();
    } catch (SQLException e) {
      throw new RecurrentStoreException("Failed to cancel statement", e);
    }
  }

  private static RecurrentStoreException failure(String sql, SQLException e) {
    return new RecurrentStoreException("Statement failed: " + sql, e);
  }

  private JdbcTemplate() {}
}
