/**
 * Spring integration for recurring jobs.
 *
 * <p>{@link recurrent.spring.SpringCronEvaluator} plugs Spring's cron support into
 * the {@link recurrent.spi.CronEvaluator} SPI used by
 * {@link recurrent.schedule.RecurringJobDefinition}.
 */
package recurrent.spring;
