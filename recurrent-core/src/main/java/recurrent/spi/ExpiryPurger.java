package recurrent.spi;

import recurrent.CancellationToken;
import recurrent.expiry.ExpiryCategory;

import java.sql.Connection;
import java.time.Instant;

/**
 * Store-specific deletion of expired records, one bounded batch per call.
 *
 * <p>Implementations cap each call at {@code limit} rows and report how many
 * rows were deleted; a result below {@code limit} tells the caller the
 * category is exhausted. A statement that fails because {@code token} was
 * cancelled, or because it timed out waiting for row locks, reports zero rows
 * instead of throwing. Any other failure propagates.
 *
 * @see recurrent.jdbc.purge.AbstractJdbcExpiryPurger
 */
public interface ExpiryPurger {

    /**
     * Deletes up to {@code limit} rows of {@code category} whose {@code expire_at} is before {@code now}.
     *
     * @return number of rows deleted
     */
    int purgeExpired(Connection conn, ExpiryCategory category, Instant now, int limit,
        CancellationToken token);

    /**
     * Deletes up to {@code limit} state history rows created before {@code createdBefore}
     * that are no longer the current state of their job.
     *
     * @return number of rows deleted
     */
    int purgeStateHistory(Connection conn, Instant createdBefore, int limit, CancellationToken token);
}
