package recurrent.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import recurrent.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code recurrent.expiry.deleted} (tag {@code category}): expired rows removed per table</li>
 *   <li>{@code recurrent.lock.contended} (tag {@code resource}): passes skipped because another server held the lock</li>
 *   <li>{@code recurrent.schedule.due}: due executions triggered</li>
 *   <li>{@code recurrent.schedule.failures}: recurring jobs whose schedule could not be computed</li>
 *   <li>{@code recurrent.schedule.disabled}: recurring jobs disabled after exhausting retries</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter dueExecutions;
  private final Counter scheduleFailures;
  private final Counter disabled;
  private final Map<String, Counter> expiredDeleted = new ConcurrentHashMap<>();
  private final Map<String, Counter> lockContended = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "recurrent"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "recurrent");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.recurrent"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.dueExecutions = Counter.builder(namePrefix + ".schedule.due")
        .description("Due recurring job executions triggered")
        .register(registry);
    this.scheduleFailures = Counter.builder(namePrefix + ".schedule.failures")
        .description("Recurring jobs whose schedule could not be computed")
        .register(registry);
    this.disabled = Counter.builder(namePrefix + ".schedule.disabled")
        .description("Recurring jobs disabled after exhausting retries")
        .register(registry);
  }

  @Override
  public void incrementExpiredDeleted(String category, long count) {
    if (closed) return;
    expiredDeleted.computeIfAbsent(category, c -> Counter.builder(namePrefix + ".expiry.deleted")
        .description("Expired records removed")
        .tag("category", c)
        .register(registry))
        .increment(count);
  }

  @Override
  public void incrementLockContended(String resource) {
    if (closed) return;
    lockContended.computeIfAbsent(resource, r -> Counter.builder(namePrefix + ".lock.contended")
        .description("Passes skipped because another server held the lock")
        .tag("resource", r)
        .register(registry))
        .increment();
  }

  @Override
  public void incrementDueExecutions(int count) {
    if (closed) return;
    dueExecutions.increment(count);
  }

  @Override
  public void incrementScheduleFailures() {
    if (closed) return;
    scheduleFailures.increment();
  }

  @Override
  public void incrementDisabled() {
    if (closed) return;
    disabled.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the sweeper and processor using the exporter are closed.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(dueExecutions, scheduleFailures, disabled));
    meters.addAll(expiredDeleted.values());
    meters.addAll(lockContended.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
