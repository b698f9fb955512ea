package recurrent.spi;

import recurrent.schedule.ChangeSet;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persistence of recurring job field maps and of the due-time index used for polling.
 *
 * @see recurrent.jdbc.store.JdbcRecurringJobStore
 */
public interface RecurringJobStore {

    /**
     * Returns ids of definitions whose next execution is at or before {@code now},
     * oldest first.
     */
    List<String> dueIds(Connection conn, Instant now, int limit);

    /**
     * Loads the stored field map of a definition; empty if it does not exist.
     */
    Map<String, String> load(Connection conn, String id);

    /**
     * Writes the changed fields (a {@code null} value removes the field) and
     * re-indexes the definition by its next execution; an empty next execution
     * removes it from due polling.
     */
    void apply(Connection conn, String id, ChangeSet changes);

    /**
     * Removes the definition and its index entry.
     *
     * @return {@code true} if anything was removed
     */
    boolean remove(Connection conn, String id);
}
