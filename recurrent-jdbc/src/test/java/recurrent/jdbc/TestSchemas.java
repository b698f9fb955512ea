package recurrent.jdbc;

import recurrent.expiry.ExpiryCategory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Schema setup and row fixtures shared by the database-backed tests.
 */
public final class TestSchemas {
  private static final AtomicLong SEQUENCE = new AtomicLong();

  private TestSchemas() {
  }

  /** A fresh in-memory H2 database with the bundled schema applied. */
  public static SimpleDataSource h2() {
    SimpleDataSource dataSource = new SimpleDataSource(
        "jdbc:h2:mem:recurrent_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
    create(dataSource, "h2");
    return dataSource;
  }

  /** Applies {@code /schema/<database>.sql}. */
  public static void create(DataSource dataSource, String database) {
    String schema = loadResource("/schema/" + database + ".sql");
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : schema.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to create schema " + database, e);
    }
  }

  public static void truncateAll(Connection conn) throws SQLException {
    TableNames names = TableNames.defaults();
    try (Statement stmt = conn.createStatement()) {
      for (ExpiryCategory category : ExpiryCategory.values()) {
        stmt.execute("DELETE FROM " + names.expiry(category));
      }
      stmt.execute("DELETE FROM " + names.state());
      stmt.execute("DELETE FROM " + names.lock());
    }
  }

  /** Inserts one row into the table of {@code category}; a {@code null} expiry never expires. */
  public static void insertExpiring(Connection conn, ExpiryCategory category, Instant expireAt)
      throws SQLException {
    String table = TableNames.defaults().expiry(category);
    String key = "key-" + SEQUENCE.incrementAndGet();
    String sql;
    switch (category) {
      case COUNTER -> sql = "INSERT INTO " + table + " (counter_key, counter_value, expire_at) VALUES (?, 1, ?)";
      case JOB -> sql = "INSERT INTO " + table + " (state_name, created_at, expire_at) VALUES (?, CURRENT_TIMESTAMP, ?)";
      case LIST -> sql = "INSERT INTO " + table + " (list_key, list_value, expire_at) VALUES (?, 'value', ?)";
      case SET -> sql = "INSERT INTO " + table + " (set_key, set_value, score, expire_at) VALUES ('fixture', ?, 0, ?)";
      case HASH -> sql = "INSERT INTO " + table + " (hash_key, field, field_value, expire_at) VALUES ('fixture', ?, 'value', ?)";
      default -> throw new IllegalArgumentException("Unknown category " + category);
    }
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, key);
      ps.setTimestamp(2, expireAt == null ? null : Timestamp.from(expireAt));
      ps.executeUpdate();
    }
  }

  /** Inserts a job with no current state and returns its id. */
  public static long insertJob(Connection conn) throws SQLException {
    String sql = "INSERT INTO " + TableNames.defaults().job()
        + " (state_name, created_at) VALUES ('Succeeded', CURRENT_TIMESTAMP)";
    try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      ps.executeUpdate();
      return generatedId(ps);
    }
  }

  /** Appends a state history row for {@code jobId} and returns its id. */
  public static long insertState(Connection conn, long jobId, String name, Instant createdAt)
      throws SQLException {
    String sql = "INSERT INTO " + TableNames.defaults().state()
        + " (job_id, name, created_at) VALUES (?, ?, ?)";
    try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      ps.setLong(1, jobId);
      ps.setString(2, name);
      ps.setTimestamp(3, Timestamp.from(createdAt));
      ps.executeUpdate();
      return generatedId(ps);
    }
  }

  public static void setCurrentState(Connection conn, long jobId, long stateId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(
        "UPDATE " + TableNames.defaults().job() + " SET state_id = ? WHERE id = ?")) {
      ps.setLong(1, stateId);
      ps.setLong(2, jobId);
      ps.executeUpdate();
    }
  }

  public static int count(Connection conn, String table) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM " + table);
         ResultSet rs = ps.executeQuery()) {
      rs.next();
      return rs.getInt(1);
    }
  }

  public static int count(Connection conn, ExpiryCategory category) throws SQLException {
    return count(conn, TableNames.defaults().expiry(category));
  }

  private static long generatedId(PreparedStatement ps) throws SQLException {
    try (ResultSet rs = ps.getGeneratedKeys()) {
      if (!rs.next()) {
        throw new SQLException("No generated key returned");
      }
      return rs.getLong(1);
    }
  }

  private static String loadResource(String path) {
    try (InputStream in = TestSchemas.class.getResourceAsStream(path)) {
      if (in == null) {
        throw new IllegalStateException("Missing resource " + path);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
