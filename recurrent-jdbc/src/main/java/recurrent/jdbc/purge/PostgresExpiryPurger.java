package recurrent.jdbc.purge;

import recurrent.jdbc.TableNames;

import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL expiry purger.
 *
 * <p>Uses the default subquery-based deletes from {@link AbstractJdbcExpiryPurger}.
 */
public final class PostgresExpiryPurger extends AbstractJdbcExpiryPurger {
    private static final String LOCK_NOT_AVAILABLE = "55P03";

    public PostgresExpiryPurger() {
        super();
    }

    public PostgresExpiryPurger(TableNames tableNames) {
        super(tableNames);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public PostgresExpiryPurger withTableNames(TableNames tableNames) {
        return new PostgresExpiryPurger(tableNames);
    }

    @Override
    protected boolean isLockTimeout(SQLException e) {
        return LOCK_NOT_AVAILABLE.equals(e.getSQLState());
    }
}
