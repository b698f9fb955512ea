package recurrent.spi;

/**
 * Observability hook for exporting sweeper and scheduler counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Adds to the count of rows removed from an expiry category.
     *
     * @param category category or table label (e.g. {@code "job"}, {@code "state"})
     * @param count    rows deleted
     */
    void incrementExpiredDeleted(String category, long count);

    /**
     * Increments the count of lock acquisitions skipped because another process held the lock.
     */
    void incrementLockContended(String resource);

    /**
     * Adds to the count of due executions triggered.
     */
    default void incrementDueExecutions(int count) {
    }

    /**
     * Increments the count of recurring jobs whose schedule could not be computed.
     */
    default void incrementScheduleFailures() {
    }

    /**
     * Increments the count of recurring jobs disabled after exhausting retries.
     */
    default void incrementDisabled() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementExpiredDeleted(String category, long count) {
        }

        @Override
        public void incrementLockContended(String resource) {
        }
    }
}
