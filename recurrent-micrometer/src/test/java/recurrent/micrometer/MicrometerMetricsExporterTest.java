package recurrent.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void expiredDeletedIsTaggedByCategory() {
    exporter.incrementExpiredDeleted("job", 1000);
    exporter.incrementExpiredDeleted("job", 500);
    exporter.incrementExpiredDeleted("hash", 3);

    assertEquals(1500.0, registry.get("recurrent.expiry.deleted").tag("category", "job").counter().count());
    assertEquals(3.0, registry.get("recurrent.expiry.deleted").tag("category", "hash").counter().count());
  }

  @Test
  void lockContendedIsTaggedByResource() {
    exporter.incrementLockContended("locks:expirationmanager");
    exporter.incrementLockContended("locks:expirationmanager");

    assertEquals(2.0, registry.get("recurrent.lock.contended")
        .tag("resource", "locks:expirationmanager").counter().count());
  }

  @Test
  void scheduleCounters() {
    exporter.incrementDueExecutions(3);
    exporter.incrementScheduleFailures();
    exporter.incrementDisabled();

    assertEquals(3.0, counter("recurrent.schedule.due").count());
    assertEquals(1.0, counter("recurrent.schedule.failures").count());
    assertEquals(1.0, counter("recurrent.schedule.disabled").count());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "billing.recurrent");
    custom.incrementDueExecutions(1);
    custom.incrementExpiredDeleted("set", 2);

    assertEquals(1.0, counter("billing.recurrent.schedule.due").count());
    assertEquals(2.0, registry.get("billing.recurrent.expiry.deleted").tag("category", "set").counter().count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementExpiredDeleted("list", 1);
    exporter.incrementLockContended("locks:recurring-jobs");

    exporter.close();
    exporter.incrementDueExecutions(5);
    exporter.incrementExpiredDeleted("list", 1);

    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "recurrent."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }
}
