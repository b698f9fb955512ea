package recurrent.jdbc.purge;

import recurrent.jdbc.TableNames;

import java.sql.SQLException;
import java.util.List;

/**
 * H2 expiry purger. Primarily for testing.
 *
 * <p>Uses the default subquery-based deletes from {@link AbstractJdbcExpiryPurger}.
 */
public final class H2ExpiryPurger extends AbstractJdbcExpiryPurger {
  // org.h2.api.ErrorCode.LOCK_TIMEOUT_1
  private static final int LOCK_TIMEOUT = 50200;

  public H2ExpiryPurger() {
    super();
  }

  public H2ExpiryPurger(TableNames tableNames) {
    super(tableNames);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public H2ExpiryPurger withTableNames(TableNames tableNames) {
    return new H2ExpiryPurger(tableNames);
  }

  @Override
  protected boolean isLockTimeout(SQLException e) {
    return e.getErrorCode() == LOCK_TIMEOUT;
  }
}
