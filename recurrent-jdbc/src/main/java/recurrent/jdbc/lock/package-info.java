/**
 * Distributed locks enforced by the shared database.
 *
 * <p>{@link recurrent.jdbc.lock.TableDistributedLock} works everywhere;
 * {@link recurrent.jdbc.lock.PostgresAdvisoryLock} and
 * {@link recurrent.jdbc.lock.MySqlNamedLock} use the database's session locks.
 */
package recurrent.jdbc.lock;
