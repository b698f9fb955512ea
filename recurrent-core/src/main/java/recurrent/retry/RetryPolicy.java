package recurrent.retry;

import java.time.Duration;

/**
 * Strategy for computing how long a recurring job waits before its schedule
 * is recomputed after a failure.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param attempt the retry attempt about to be scheduled (1-based)
     * @return non-negative delay
     */
    Duration computeDelay(int attempt);
}
