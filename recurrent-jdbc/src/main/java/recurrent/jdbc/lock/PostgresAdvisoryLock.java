package recurrent.jdbc.lock;

import recurrent.jdbc.JdbcTemplate;
import recurrent.spi.DistributedLock;

import java.sql.Connection;
import java.time.Duration;
import java.util.Objects;

/**
 * PostgreSQL session-level advisory lock keyed by {@code hashtext(resource)}.
 *
 * <p>The lock lives as long as the database session, so a crashed process
 * releases it automatically. Pooled connections must release before they are returned.
 */
public final class PostgresAdvisoryLock implements DistributedLock {
    private final Duration pollInterval;

    public PostgresAdvisoryLock() {
        this(PollingLock.DEFAULT_POLL_INTERVAL);
    }

    public PostgresAdvisoryLock(Duration pollInterval) {
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    @Override
    public void acquire(Connection conn, String resource, Duration timeout) {
        Objects.requireNonNull(resource, "resource");
        PollingLock.acquire(resource, timeout, pollInterval, () -> tryLock(conn, resource));
    }

    @Override
    public void release(Connection conn, String resource) {
        boolean released = JdbcTemplate.queryFirst(conn,
                "SELECT pg_advisory_unlock(hashtext(?))", rs -> rs.getBoolean(1), resource).orElse(false);
        if (!released) {
            throw new IllegalStateException("Advisory lock on '" + resource + "' is not held by this session");
        }
    }

    private static boolean tryLock(Connection conn, String resource) {
        return JdbcTemplate.queryFirst(conn,
                "SELECT pg_try_advisory_lock(hashtext(?))", rs -> rs.getBoolean(1), resource).orElse(false);
    }
}
