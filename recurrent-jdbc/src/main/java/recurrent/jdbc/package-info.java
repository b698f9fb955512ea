/**
 * JDBC implementations of the store SPIs.
 *
 * <p>{@link recurrent.jdbc.purge.JdbcExpiryPurgers} picks the expiry purger for a
 * database, {@link recurrent.jdbc.lock.JdbcDistributedLocks} the lock, and
 * {@link recurrent.jdbc.store.JdbcRecurringJobStore} keeps recurring job
 * definitions. Table names come from {@link recurrent.jdbc.TableNames}; DDL for
 * H2, PostgreSQL and MySQL ships under {@code schema/}.
 */
package recurrent.jdbc;
