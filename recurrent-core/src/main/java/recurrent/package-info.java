/**
 * Time-driven maintenance core of a distributed background-job scheduler.
 *
 * <p>Two components live here:
 * <ul>
 *   <li>{@link recurrent.schedule.RecurringJobDefinition} reconciles a recurring job's
 *       persisted snapshot against wall-clock time and a misfire policy.
 *   <li>{@link recurrent.expiry.ExpirySweeper} purges expired records in bounded batches
 *       under a distributed lock shared by all server processes.
 * </ul>
 *
 * <p>Store-specific behavior plugs in through the interfaces in {@link recurrent.spi}.
 */
package recurrent;
