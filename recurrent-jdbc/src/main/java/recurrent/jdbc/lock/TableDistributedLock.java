package recurrent.jdbc.lock;

import recurrent.RecurrentStoreException;
import recurrent.jdbc.JdbcTemplate;
import recurrent.jdbc.TableNames;
import recurrent.spi.DistributedLock;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Portable lock backed by one row per held resource in the lock table.
 *
 * <p>Acquiring inserts the row; a duplicate key means another owner holds the
 * lock and the insert is retried until the timeout. Each row carries a lease:
 * a row whose lease has run out was left behind by a crashed process and is
 * taken over. The lease must therefore exceed the longest time the lock is held.
 *
 * <p>Statements run in auto-commit mode so other processes see the row at once.
 */
public final class TableDistributedLock implements DistributedLock {
  private static final Logger logger = Logger.getLogger(TableDistributedLock.class.getName());

  public static final Duration DEFAULT_LEASE = Duration.ofMinutes(30);

  private final String tableName;
  private final Duration lease;
  private final Duration pollInterval;
  private final Clock clock;
  private final Map<Connection, Map<String, String>> owners = new IdentityHashMap<>();

  public TableDistributedLock() {
    this(TableNames.defaults());
  }

  public TableDistributedLock(TableNames tableNames) {
    this(tableNames, DEFAULT_LEASE, PollingLock.DEFAULT_POLL_INTERVAL, Clock.systemUTC());
  }

  public TableDistributedLock(TableNames tableNames, Duration lease, Duration pollInterval, Clock clock) {
    this.tableName = Objects.requireNonNull(tableNames, "tableNames").lock();
    this.lease = Objects.requireNonNull(lease, "lease");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (lease.isNegative() || lease.isZero()) {
      throw new IllegalArgumentException("lease must be > 0");
    }
  }

  @Override
  public void acquire(Connection conn, String resource, Duration timeout) {
    Objects.requireNonNull(resource, "resource");
    String owner = UUID.randomUUID().toString();
    PollingLock.acquire(resource, timeout, pollInterval, () -> tryAcquire(conn, resource, owner));
    synchronized (owners) {
      owners.computeIfAbsent(conn, c -> new HashMap<>()).put(resource, owner);
    }
  }

  @Override
  public void release(Connection conn, String resource) {
    String owner;
    synchronized (owners) {
      Map<String, String> held = owners.get(conn);
      owner = held == null ? null : held.remove(resource);
      if (held != null && held.isEmpty()) {
        owners.remove(conn);
      }
    }
    if (owner == null) {
      throw new IllegalStateException("Lock on '" + resource + "' is not held by this connection");
    }
    int deleted = JdbcTemplate.update(conn,
        "DELETE FROM " + tableName + " WHERE resource = ? AND owner = ?", resource, owner);
    if (deleted == 0) {
      logger.log(Level.WARNING, "Lock on {0} was taken over before release; its lease may be too short",
          resource);
    }
  }

  private boolean tryAcquire(Connection conn, String resource, String owner) {
    Instant now = clock.instant();
    Timestamp acquiredAt = Timestamp.from(now);
    Timestamp expireAt = Timestamp.from(now.plus(lease));
    String insert = "INSERT INTO " + tableName + " (resource, owner, acquired_at, expire_at) VALUES (?, ?, ?, ?)";
    try (PreparedStatement ps = conn.prepareStatement(insert)) {
      ps.setString(1, resource);
      ps.setString(2, owner);
      ps.setTimestamp(3, acquiredAt);
      ps.setTimestamp(4, expireAt);
      ps.executeUpdate();
      return true;
    } catch (SQLException e) {
      if (!isDuplicateKey(e)) {
        throw new RecurrentStoreException("Failed to acquire lock on '" + resource + "'", e);
      }
    }
    int takenOver = JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET owner = ?, acquired_at = ?, expire_at = ? WHERE resource = ? AND expire_at < ?",
        owner, acquiredAt, expireAt, resource, acquiredAt);
    if (takenOver > 0) {
      logger.log(Level.WARNING, "Took over abandoned lock on {0}", resource);
      return true;
    }
    return false;
  }

  private static boolean isDuplicateKey(SQLException e) {
    String state = e.getSQLState();
    return state != null && state.startsWith("23");
  }
}
