package recurrent.jdbc.lock;

import recurrent.DistributedLockTimeoutException;
import recurrent.jdbc.SimpleDataSource;
import recurrent.jdbc.TableNames;
import recurrent.jdbc.TestSchemas;
import recurrent.spi.DistributedLock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TableDistributedLockTest {
  private static final String RESOURCE = "locks:test";
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private SimpleDataSource dataSource;
  private Connection first;
  private Connection second;

  @BeforeEach
  void setup() throws Exception {
    dataSource = TestSchemas.h2();
    first = dataSource.getConnection();
    second = dataSource.getConnection();
  }

  @AfterEach
  void tearDown() throws Exception {
    first.close();
    second.close();
  }

  @Test
  void acquireInsertsRowAndReleaseDeletesIt() throws Exception {
    TableDistributedLock lock = new TableDistributedLock();

    lock.acquire(first, RESOURCE, Duration.ofSeconds(1));
    assertEquals(1, TestSchemas.count(first, TableNames.defaults().lock()));

    lock.release(first, RESOURCE);
    assertEquals(0, TestSchemas.count(first, TableNames.defaults().lock()));
  }

  @Test
  void contendedLockTimesOut() {
    TableDistributedLock lock = new TableDistributedLock(
        TableNames.defaults(), Duration.ofMinutes(5), Duration.ofMillis(20), Clock.systemUTC());
    lock.acquire(first, RESOURCE, Duration.ofSeconds(1));

    DistributedLockTimeoutException ex = assertThrows(DistributedLockTimeoutException.class,
        () -> lock.acquire(second, RESOURCE, Duration.ofMillis(150)));

    assertEquals(RESOURCE, ex.resource());
    assertEquals(Duration.ofMillis(150), ex.timeout());
  }

  @Test
  void differentResourcesDoNotContend() {
    TableDistributedLock lock = new TableDistributedLock();
    lock.acquire(first, RESOURCE, Duration.ofSeconds(1));

    assertDoesNotThrow(() -> lock.acquire(second, "locks:other", Duration.ofMillis(100)));
  }

  @Test
  void closingHandleLetsAnotherConnectionAcquire() throws Exception {
    TableDistributedLock lock = new TableDistributedLock();
    DistributedLock.Handle handle = lock.hold(first, RESOURCE, Duration.ofSeconds(1));
    assertEquals(1, TestSchemas.count(first, TableNames.defaults().lock()));

    handle.close();

    assertDoesNotThrow(() -> lock.hold(second, RESOURCE, Duration.ofMillis(100)).close());
  }

  @Test
  void expiredLeaseIsTakenOver() throws Exception {
    TableDistributedLock crashed = new TableDistributedLock(
        TableNames.defaults(), Duration.ofMinutes(1), Duration.ofMillis(20), Clock.fixed(NOW, ZoneOffset.UTC));
    TableDistributedLock later = new TableDistributedLock(
        TableNames.defaults(), Duration.ofMinutes(1), Duration.ofMillis(20),
        Clock.fixed(NOW.plus(Duration.ofMinutes(2)), ZoneOffset.UTC));
    crashed.acquire(first, RESOURCE, Duration.ofSeconds(1));

    later.acquire(second, RESOURCE, Duration.ofMillis(200));

    // the stale owner no longer matches, so its release leaves the new row alone
    crashed.release(first, RESOURCE);
    assertEquals(1, TestSchemas.count(second, TableNames.defaults().lock()));
    later.release(second, RESOURCE);
    assertEquals(0, TestSchemas.count(second, TableNames.defaults().lock()));
  }

  @Test
  void releaseWithoutAcquireThrows() {
    TableDistributedLock lock = new TableDistributedLock();

    assertThrows(IllegalStateException.class, () -> lock.release(first, RESOURCE));
  }

  @Test
  void nonPositiveLeaseIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new TableDistributedLock(
        TableNames.defaults(), Duration.ZERO, Duration.ofMillis(20), Clock.systemUTC()));
  }
}
