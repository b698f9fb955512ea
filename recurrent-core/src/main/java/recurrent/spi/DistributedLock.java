package recurrent.spi;

import java.sql.Connection;
import java.time.Duration;

/**
 * Named mutual-exclusion primitive enforced by the shared store and held
 * across independent server processes.
 *
 * <p>Locks are bound to the connection they were acquired on; release must
 * use the same connection. Use {@link #hold} with try-with-resources so the
 * lock is released on every exit path.
 *
 * @see recurrent.jdbc.lock.TableDistributedLock
 */
public interface DistributedLock {

    /**
     * Acquires the lock on {@code resource}, blocking up to {@code timeout}.
     *
     * @throws recurrent.DistributedLockTimeoutException if the lock was not obtained in time
     */
    void acquire(Connection conn, String resource, Duration timeout);

    /**
     * Releases a lock previously acquired on the same connection.
     */
    void release(Connection conn, String resource);

    /**
     * Acquires the lock and returns a handle that releases it when closed.
     *
     * <pre>{@code
     * try (DistributedLock.Handle ignored = lock.hold(conn, "locks:x", Duration.ofSeconds(5))) {
     *   // exclusive work
     * }
     * }</pre>
     */
    default Handle hold(Connection conn, String resource, Duration timeout) {
        acquire(conn, resource, timeout);
        return () -> release(conn, resource);
    }

    /** Scoped lock ownership; closing releases the lock. */
    @FunctionalInterface
    interface Handle extends AutoCloseable {
        @Override
        void close();
    }
}
