package recurrent;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown when a distributed lock cannot be acquired within its timeout because
 * another process holds it.
 *
 * <p>Callers usually treat this as contention rather than failure: another
 * cooperating server is presumed to be doing the same work.
 */
public final class DistributedLockTimeoutException extends RuntimeException {
  private final String resource;
  private final Duration timeout;

  public DistributedLockTimeoutException(String resource, Duration timeout) {
    super("Timeout expired while acquiring distributed lock on '" + resource
        + "' resource within " + timeout.toMillis() + " ms");
    this.resource = Objects.requireNonNull(resource, "resource");
    this.timeout = timeout;
  }

  /**
   * Returns the contended lock resource key.
   */
  public String resource() {
    return resource;
  }

  public Duration timeout() {
    return timeout;
  }
}
