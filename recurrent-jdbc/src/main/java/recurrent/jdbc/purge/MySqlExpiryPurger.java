package recurrent.jdbc.purge;

import recurrent.CancellationToken;
import recurrent.expiry.ExpiryCategory;
import recurrent.jdbc.TableNames;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * MySQL expiry purger. Also compatible with TiDB.
 *
 * <p>Overrides with {@code DELETE ... ORDER BY ... LIMIT}, which MySQL supports
 * natively and avoids the self-referencing subquery MySQL rejects.
 */
public final class MySqlExpiryPurger extends AbstractJdbcExpiryPurger {
  // ER_LOCK_WAIT_TIMEOUT
  private static final int LOCK_WAIT_TIMEOUT = 1205;

  public MySqlExpiryPurger() {
    super();
  }

  public MySqlExpiryPurger(TableNames tableNames) {
    super(tableNames);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public MySqlExpiryPurger withTableNames(TableNames tableNames) {
    return new MySqlExpiryPurger(tableNames);
  }

  @Override
  protected boolean isLockTimeout(SQLException e) {
    return e.getErrorCode() == LOCK_WAIT_TIMEOUT;
  }

  @Override
  public int purgeExpired(Connection conn, ExpiryCategory category, Instant now, int limit,
      CancellationToken token) {
    String sql = "DELETE FROM " + tableNames().expiry(category) +
        " WHERE expire_at < ?" +
        " ORDER BY expire_at LIMIT ?";
    return executeBatch(conn, token, sql, now, limit);
  }

  @Override
  public int purgeStateHistory(Connection conn, Instant createdBefore, int limit, CancellationToken token) {
    // the derived table is materialized, so MySQL allows deleting from the table it reads
    String sql = "DELETE s FROM " + tableNames().state() + " s JOIN (" +
        "SELECT s2.id FROM " + tableNames().state() + " s2" +
        " JOIN " + tableNames().job() + " j ON j.id = s2.job_id" +
        " WHERE s2.created_at < ? AND j.state_id <> s2.id" +
        " ORDER BY s2.created_at LIMIT ?) d ON d.id = s.id";
    return executeBatch(conn, token, sql, createdBefore, limit);
  }
}
