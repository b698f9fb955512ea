/**
 * Service provider interfaces for store access, distributed locking, cron
 * evaluation, payload serialization and metrics.
 *
 * <p>JDBC implementations live in {@code recurrent.jdbc}; the Spring-backed
 * {@link recurrent.spi.CronEvaluator} lives in {@code recurrent.spring}.
 */
package recurrent.spi;
