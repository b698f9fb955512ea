package recurrent.jdbc.lock;

import recurrent.jdbc.TableNames;
import recurrent.spi.DistributedLock;

import java.util.Locale;
import java.util.Objects;

/**
 * Chooses a {@link DistributedLock} for a database.
 */
public final class JdbcDistributedLocks {

  private JdbcDistributedLocks() {
  }

  /**
   * The portable lock-table implementation, usable on every supported database.
   */
  public static DistributedLock table(TableNames tableNames) {
    return new TableDistributedLock(tableNames);
  }

  /**
   * The native session lock of the database behind {@code jdbcUrl}: advisory
   * locks on PostgreSQL, named locks on MySQL. Other databases fall back to
   * the lock table.
   */
  public static DistributedLock nativeOrTable(String jdbcUrl, TableNames tableNames) {
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    String normalized = jdbcUrl.toLowerCase(Locale.ROOT);
    if (normalized.startsWith("jdbc:postgresql:")) {
      return new PostgresAdvisoryLock();
    }
    if (normalized.startsWith("jdbc:mysql:") || normalized.startsWith("jdbc:tidb:")) {
      return new MySqlNamedLock();
    }
    return table(tableNames);
  }
}
