/**
 * Spring Boot auto-configuration for recurrent.
 *
 * <p>{@link recurrent.spring.boot.RecurrentAutoConfiguration} wires the expiry sweeper,
 * the recurring job manager and, on nodes that fire jobs, the recurring job processor
 * from a {@link javax.sql.DataSource} and {@link recurrent.spring.boot.RecurrentProperties}.
 */
package recurrent.spring.boot;
