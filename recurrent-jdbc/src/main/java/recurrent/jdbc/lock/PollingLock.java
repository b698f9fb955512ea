package recurrent.jdbc.lock;

import recurrent.DistributedLockTimeoutException;

import java.time.Duration;

/**
 * Retry loop shared by locks that can only be tried, not waited on.
 */
final class PollingLock {
  static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

  @FunctionalInterface
  interface Attempt {
    boolean tryAcquire();
  }

  private PollingLock() {
  }

  /**
   * Calls {@code attempt} until it succeeds or {@code timeout} elapses.
   *
   * @throws DistributedLockTimeoutException if the lock was not obtained in time, or the
   *     waiting thread was interrupted
   */
  static void acquire(String resource, Duration timeout, Duration pollInterval, Attempt attempt) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      if (attempt.tryAcquire()) {
        return;
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        throw new DistributedLockTimeoutException(resource, timeout);
      }
      try {
        Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DistributedLockTimeoutException(resource, timeout);
      }
    }
  }
}
