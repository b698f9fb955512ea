package recurrent.jdbc.lock;

import recurrent.DistributedLockTimeoutException;
import recurrent.RecurrentStoreException;
import recurrent.jdbc.JdbcTemplate;
import recurrent.spi.DistributedLock;

import java.sql.Connection;
import java.time.Duration;
import java.util.Objects;

/**
 * MySQL named lock ({@code GET_LOCK} / {@code RELEASE_LOCK}), held by the session.
 *
 * <p>MySQL waits for the lock itself, in whole seconds. Names are limited to 64 characters.
 */
public final class MySqlNamedLock implements DistributedLock {
  private static final int MAX_NAME_LENGTH = 64;

  @Override
  public void acquire(Connection conn, String resource, Duration timeout) {
    Objects.requireNonNull(resource, "resource");
    if (resource.length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException("MySQL lock names are limited to 64 characters: " + resource);
    }
    long seconds = (timeout.toMillis() + 999) / 1000;
    int acquired = JdbcTemplate.queryFirst(conn, "SELECT GET_LOCK(?, ?)",
            rs -> {
              int value = rs.getInt(1);
              return rs.wasNull() ? null : value;
            },
            resource, seconds)
        .orElseThrow(() -> new RecurrentStoreException("GET_LOCK failed for '" + resource + "'"));
    if (acquired != 1) {
      throw new DistributedLockTimeoutException(resource, timeout);
    }
  }

  @Override
  public void release(Connection conn, String resource) {
    JdbcTemplate.query(conn, "SELECT RELEASE_LOCK(?)", rs -> rs.getObject(1), resource);
  }
}
