/**
 * Recurring job scheduling: cron evaluation with misfire handling, change detection
 * and the processor that fires due definitions.
 *
 * <p>{@link recurrent.schedule.RecurringJobDefinition} is the reconciler. It is
 * rebuilt from stored fields on every use and reports the minimal diff to write
 * back. {@link recurrent.schedule.RecurringJobProcessor} drives it for due
 * definitions and {@link recurrent.schedule.RecurringJobManager} maintains them.
 *
 * @see recurrent.schedule.MisfireMode
 */
package recurrent.schedule;
