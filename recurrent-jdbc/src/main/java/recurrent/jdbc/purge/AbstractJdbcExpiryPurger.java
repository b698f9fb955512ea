package recurrent.jdbc.purge;

import recurrent.CancellationToken;
import recurrent.RecurrentStoreException;
import recurrent.expiry.ExpiryCategory;
import recurrent.jdbc.JdbcTemplate;
import recurrent.jdbc.TableNames;
import recurrent.spi.ExpiryPurger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC expiry purger with default subquery-based SQL that works for H2
 * and PostgreSQL.
 *
 * <p>Subclasses name the database they serve and classify its lock-wait
 * timeout errors. They may override the delete statements for databases that
 * support more efficient syntax (MySQL supports {@code DELETE ... ORDER BY ... LIMIT}).
 * Register custom implementations via
 * {@code META-INF/services/recurrent.jdbc.purge.AbstractJdbcExpiryPurger}.
 *
 * @see JdbcExpiryPurgers
 */
public abstract class AbstractJdbcExpiryPurger implements ExpiryPurger {
  private static final Logger logger = Logger.getLogger(AbstractJdbcExpiryPurger.class.getName());

  private final TableNames tableNames;

  protected AbstractJdbcExpiryPurger() {
    this(TableNames.defaults());
  }

  protected AbstractJdbcExpiryPurger(TableNames tableNames) {
    this.tableNames = Objects.requireNonNull(tableNames, "tableNames");
  }

  /**
   * Unique identifier for this purger (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this purger handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a purger of the same kind working on {@code tableNames}.
   */
  public abstract AbstractJdbcExpiryPurger withTableNames(TableNames tableNames);

  /**
   * Whether {@code e} reports that the statement gave up waiting for row locks.
   */
  protected abstract boolean isLockTimeout(SQLException e);

  protected TableNames tableNames() {
    return tableNames;
  }

  @Override
  public int purgeExpired(Connection conn, ExpiryCategory category, Instant now, int limit,
      CancellationToken token) {
    String table = tableNames.expiry(category);
    String sql = "DELETE FROM " + table + " WHERE id IN (" +
        "SELECT id FROM " + table +
        " WHERE expire_at < ?" +
        " ORDER BY expire_at LIMIT ?)";
    return executeBatch(conn, token, sql, now, limit);
  }

  /**
   * Deletes superseded state rows. A state row is kept while its job still
   * points at it, and rows of jobs that no longer exist are left to the job's own expiry.
   */
  @Override
  public int purgeStateHistory(Connection conn, Instant createdBefore, int limit, CancellationToken token) {
    String sql = "DELETE FROM " + tableNames.state() + " WHERE id IN (" +
        "SELECT s.id FROM " + tableNames.state() + " s" +
        " JOIN " + tableNames.job() + " j ON j.id = s.job_id" +
        " WHERE s.created_at < ? AND j.state_id <> s.id" +
        " ORDER BY s.created_at LIMIT ?)";
    return executeBatch(conn, token, sql, createdBefore, limit);
  }

  /**
   * Runs one bounded delete. A statement that fails because {@code token} was
   * cancelled or because it timed out waiting for locks counts as zero rows.
   */
  protected final int executeBatch(Connection conn, CancellationToken token, String sql, Object... params) {
    try {
      return JdbcTemplate.update(conn, token, sql, params);
    } catch (RecurrentStoreException e) {
      if (token.isCancellationRequested()) {
        logger.log(Level.FINE, "Expiry batch cancelled", e);
        return 0;
      }
      if (e.getCause() instanceof SQLException sqlException && isLockTimeout(sqlException)) {
        logger.log(Level.FINE, "Expiry batch timed out waiting for row locks", e);
        return 0;
      }
      throw e;
    }
  }
}
