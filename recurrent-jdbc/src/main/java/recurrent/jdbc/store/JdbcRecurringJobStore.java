package recurrent.jdbc.store;

import recurrent.RecurrentStoreException;
import recurrent.jdbc.JdbcTemplate;
import recurrent.jdbc.TableNames;
import recurrent.schedule.ChangeSet;
import recurrent.spi.RecurringJobStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps recurring job definitions in the hash table and their due-time index
 * in the set table.
 *
 * <p>Definition {@code X} is stored as the fields of hash {@code recurring-job:X}.
 * The set {@value #INDEX_KEY} holds {@code X} scored by its next execution in
 * epoch milliseconds; a definition without a next execution has no index entry
 * and is never polled. Portable SQL only, so one implementation serves every
 * supported database.
 */
public final class JdbcRecurringJobStore implements RecurringJobStore {
  public static final String KEY_PREFIX = "recurring-job:";
  public static final String INDEX_KEY = "recurring-jobs";

  private final String hashTable;
  private final String setTable;

  public JdbcRecurringJobStore() {
    this(TableNames.defaults());
  }

  public JdbcRecurringJobStore(TableNames tableNames) {
    Objects.requireNonNull(tableNames, "tableNames");
    this.hashTable = tableNames.hash();
    this.setTable = tableNames.set();
  }

  @Override
  public List<String> dueIds(Connection conn, Instant now, int limit) {
    return JdbcTemplate.query(conn,
        "SELECT set_value FROM " + setTable + " WHERE set_key = ? AND score <= ? ORDER BY score LIMIT ?",
        rs -> rs.getString("set_value"),
        INDEX_KEY, now.toEpochMilli(), limit);
  }

  @Override
  public Map<String, String> load(Connection conn, String id) {
    Map<String, String> fields = new LinkedHashMap<>();
    JdbcTemplate.query(conn,
        "SELECT field, field_value FROM " + hashTable + " WHERE hash_key = ? ORDER BY id",
        rs -> fields.put(rs.getString("field"), rs.getString("field_value")),
        KEY_PREFIX + id);
    return fields;
  }

  /**
   * Writes the changes in a single transaction, restoring the connection's
   * auto-commit mode afterwards.
   */
  @Override
  public void apply(Connection conn, String id, ChangeSet changes) {
    inTransaction(conn, () -> {
      String key = KEY_PREFIX + id;
      changes.changedFields().forEach((field, value) -> {
        if (value == null) {
          JdbcTemplate.update(conn, "DELETE FROM " + hashTable + " WHERE hash_key = ? AND field = ?", key, field);
        } else if (JdbcTemplate.update(conn,
            "UPDATE " + hashTable + " SET field_value = ? WHERE hash_key = ? AND field = ?", value, key, field) == 0) {
          JdbcTemplate.update(conn,
              "INSERT INTO " + hashTable + " (hash_key, field, field_value) VALUES (?, ?, ?)", key, field, value);
        }
      });

      if (changes.nextExecution().isPresent()) {
        long score = changes.nextExecution().get().toEpochMilli();
        if (JdbcTemplate.update(conn,
            "UPDATE " + setTable + " SET score = ? WHERE set_key = ? AND set_value = ?", score, INDEX_KEY, id) == 0) {
          JdbcTemplate.update(conn,
              "INSERT INTO " + setTable + " (set_key, set_value, score) VALUES (?, ?, ?)", INDEX_KEY, id, score);
        }
      } else {
        JdbcTemplate.update(conn, "DELETE FROM " + setTable + " WHERE set_key = ? AND set_value = ?", INDEX_KEY, id);
      }
      return null;
    });
  }

  @Override
  public boolean remove(Connection conn, String id) {
    return inTransaction(conn, () -> {
      int fields = JdbcTemplate.update(conn, "DELETE FROM " + hashTable + " WHERE hash_key = ?", KEY_PREFIX + id);
      int indexed = JdbcTemplate.update(conn,
          "DELETE FROM " + setTable + " WHERE set_key = ? AND set_value = ?", INDEX_KEY, id);
      return fields + indexed > 0;
    });
  }

  /**
   * Lists the ids of every indexed definition, ordered by next execution.
   */
  public List<String> indexedIds(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT set_value FROM " + setTable + " WHERE set_key = ? ORDER BY score",
        rs -> rs.getString("set_value"), INDEX_KEY);
  }

  private static <T> T inTransaction(Connection conn, Work<T> work) {
    try {
      boolean autoCommit = conn.getAutoCommit();
      if (!autoCommit) {
        return work.run();
      }
      conn.setAutoCommit(false);
      try {
        T result = work.run();
        conn.commit();
        return result;
      } catch (RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      throw new RecurrentStoreException("Failed to manage transaction", e);
    }
  }

  private static void rollback(Connection conn, RuntimeException cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  @FunctionalInterface
  private interface Work<T> {
    T run();
  }
}
