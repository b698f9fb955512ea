package recurrent.jdbc.purge;

import recurrent.CancellationToken;
import recurrent.RecurrentStoreException;
import recurrent.expiry.ExpiryCategory;
import recurrent.jdbc.SimpleDataSource;
import recurrent.jdbc.TableNames;
import recurrent.jdbc.TestSchemas;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class H2ExpiryPurgerTest {
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private final H2ExpiryPurger purger = new H2ExpiryPurger();
  private final CancellationToken token = new CancellationToken();
  private SimpleDataSource dataSource;
  private Connection conn;

  @BeforeEach
  void setup() throws Exception {
    dataSource = TestSchemas.h2();
    conn = dataSource.getConnection();
    conn.setAutoCommit(true);
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
  }

  @Test
  void deletesOnlyRowsExpiredBeforeNow() throws Exception {
    for (int i = 0; i < 3; i++) {
      TestSchemas.insertExpiring(conn, ExpiryCategory.JOB, NOW.minusSeconds(60));
    }
    TestSchemas.insertExpiring(conn, ExpiryCategory.JOB, NOW.plusSeconds(60));
    TestSchemas.insertExpiring(conn, ExpiryCategory.JOB, null);

    int deleted = purger.purgeExpired(conn, ExpiryCategory.JOB, NOW, 100, token);

    assertEquals(3, deleted);
    assertEquals(2, TestSchemas.count(conn, ExpiryCategory.JOB));
  }

  @Test
  void rowExpiringExactlyNowIsKept() throws Exception {
    TestSchemas.insertExpiring(conn, ExpiryCategory.HASH, NOW);

    assertEquals(0, purger.purgeExpired(conn, ExpiryCategory.HASH, NOW, 100, token));
    assertEquals(1, TestSchemas.count(conn, ExpiryCategory.HASH));
  }

  @Test
  void respectsBatchLimit() throws Exception {
    for (int i = 0; i < 5; i++) {
      TestSchemas.insertExpiring(conn, ExpiryCategory.LIST, NOW.minusSeconds(i + 1));
    }

    assertEquals(3, purger.purgeExpired(conn, ExpiryCategory.LIST, NOW, 3, token));
    assertEquals(2, purger.purgeExpired(conn, ExpiryCategory.LIST, NOW, 3, token));
    assertEquals(0, purger.purgeExpired(conn, ExpiryCategory.LIST, NOW, 3, token));
  }

  @Test
  void everyCategoryHasItsOwnTable() throws Exception {
    for (ExpiryCategory category : ExpiryCategory.values()) {
      TestSchemas.insertExpiring(conn, category, NOW.minusSeconds(1));
    }

    for (ExpiryCategory category : ExpiryCategory.values()) {
      assertEquals(1, purger.purgeExpired(conn, category, NOW, 10, token), category.name());
      assertEquals(0, TestSchemas.count(conn, category), category.name());
    }
  }

  @Test
  void stateHistoryKeepsCurrentStateOfEachJob() throws Exception {
    Instant old = NOW.minus(Duration.ofDays(10));
    long job = TestSchemas.insertJob(conn);
    TestSchemas.insertState(conn, job, "Enqueued", old);
    TestSchemas.insertState(conn, job, "Processing", old.plusSeconds(1));
    long current = TestSchemas.insertState(conn, job, "Succeeded", old.plusSeconds(2));
    TestSchemas.setCurrentState(conn, job, current);

    int deleted = purger.purgeStateHistory(conn, NOW.minus(Duration.ofDays(1)), 100, token);

    assertEquals(2, deleted);
    assertEquals(1, TestSchemas.count(conn, TableNames.defaults().state()));
  }

  @Test
  void stateHistoryRespectsRetentionCutoff() throws Exception {
    long job = TestSchemas.insertJob(conn);
    TestSchemas.insertState(conn, job, "Enqueued", NOW.minus(Duration.ofHours(1)));
    long current = TestSchemas.insertState(conn, job, "Succeeded", NOW.minus(Duration.ofMinutes(30)));
    TestSchemas.setCurrentState(conn, job, current);

    assertEquals(0, purger.purgeStateHistory(conn, NOW.minus(Duration.ofDays(1)), 100, token));
    assertEquals(1, purger.purgeStateHistory(conn, NOW, 100, token));
  }

  @Test
  void stateHistoryOfJobWithoutCurrentStateIsKept() throws Exception {
    long job = TestSchemas.insertJob(conn);
    TestSchemas.insertState(conn, job, "Enqueued", NOW.minus(Duration.ofDays(10)));

    assertEquals(0, purger.purgeStateHistory(conn, NOW, 100, token));
  }

  @Test
  void rowLockTimeoutCountsAsZeroRows() throws Exception {
    TestSchemas.insertExpiring(conn, ExpiryCategory.LIST, NOW.minusSeconds(60));
    try (Connection holder = dataSource.getConnection()) {
      holdRowLocks(holder, "recurrent_list");
      try (Statement stmt = conn.createStatement()) {
        stmt.execute("SET LOCK_TIMEOUT 200");
      }

      assertEquals(0, purger.purgeExpired(conn, ExpiryCategory.LIST, NOW, 100, token));

      holder.rollback();
    }
    assertEquals(1, purger.purgeExpired(conn, ExpiryCategory.LIST, NOW, 100, token));
  }

  @Test
  void cancellingWhileBlockedCountsAsZeroRows() throws Exception {
    TestSchemas.insertExpiring(conn, ExpiryCategory.HASH, NOW.minusSeconds(60));
    ScheduledExecutorService canceller = Executors.newSingleThreadScheduledExecutor();
    try (Connection holder = dataSource.getConnection()) {
      holdRowLocks(holder, "recurrent_hash");
      try (Statement stmt = conn.createStatement()) {
        stmt.execute("SET LOCK_TIMEOUT 3000");
      }
      canceller.schedule(token::cancel, 200, TimeUnit.MILLISECONDS);

      assertEquals(0, purger.purgeExpired(conn, ExpiryCategory.HASH, NOW, 100, token));
      assertTrue(token.isCancellationRequested());

      holder.rollback();
    } finally {
      canceller.shutdownNow();
    }
    assertEquals(1, TestSchemas.count(conn, ExpiryCategory.HASH));
  }

  @Test
  void failedStatementAfterCancellationCountsAsZeroRows() {
    FailingPurger failing = new FailingPurger();
    token.cancel();

    assertEquals(0, failing.purgeExpired(conn, ExpiryCategory.JOB, NOW, 100, token));
  }

  @Test
  void otherFailuresPropagate() {
    FailingPurger failing = new FailingPurger();

    RecurrentStoreException e = assertThrows(RecurrentStoreException.class,
        () -> failing.purgeExpired(conn, ExpiryCategory.JOB, NOW, 100, token));
    assertInstanceOf(SQLException.class, e.getCause());
  }

  private static void holdRowLocks(Connection holder, String table) throws SQLException {
    holder.setAutoCommit(false);
    try (Statement stmt = holder.createStatement()) {
      stmt.executeUpdate("UPDATE " + table + " SET expire_at = expire_at");
    }
  }

  /** Runs its deletes against a table that does not exist. */
  private static final class FailingPurger extends AbstractJdbcExpiryPurger {
    @Override
    public String name() {
      return "failing";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
      return List.of("jdbc:failing:");
    }

    @Override
    public AbstractJdbcExpiryPurger withTableNames(TableNames tableNames) {
      return this;
    }

    @Override
    protected boolean isLockTimeout(SQLException e) {
      return false;
    }

    @Override
    public int purgeExpired(Connection conn, ExpiryCategory category, Instant now, int limit,
        CancellationToken token) {
      return executeBatch(conn, token, "DELETE FROM missing_table WHERE expire_at < ?", now);
    }
  }
}
