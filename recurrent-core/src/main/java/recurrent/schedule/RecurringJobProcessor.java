package recurrent.schedule;

import recurrent.DistributedLockTimeoutException;
import recurrent.retry.ExponentialBackoffRetryPolicy;
import recurrent.retry.RetryPolicy;
import recurrent.spi.ConnectionProvider;
import recurrent.spi.DistributedLock;
import recurrent.spi.JobTrigger;
import recurrent.spi.MetricsExporter;
import recurrent.spi.RecurringJobStore;
import recurrent.util.DaemonThreadFactory;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that fires due recurring jobs.
 *
 * <p>Each cycle takes the distributed lock {@value #LOCK_RESOURCE}, reads the
 * ids whose next execution has passed, and for each one computes its due
 * executions, fires them through the {@link JobTrigger} and writes back the
 * changed fields. A definition whose schedule cannot be computed is retried
 * with backoff until {@code maxRetryAttempts} is reached, then disabled.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see RecurringJobDefinition
 */
public final class RecurringJobProcessor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RecurringJobProcessor.class.getName());

  /** Name of the distributed lock guarding a processing cycle. */
  public static final String LOCK_RESOURCE = "locks:recurring-jobs";

  private final ConnectionProvider connectionProvider;
  private final RecurringJobStore store;
  private final DistributedLock lock;
  private final RecurringJobFactory factory;
  private final JobTrigger trigger;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int maxRetryAttempts;
  private final int batchSize;
  private final Duration precision;
  private final Duration interval;
  private final Duration lockTimeout;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  private RecurringJobProcessor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.lock = Objects.requireNonNull(builder.lock, "lock");
    this.factory = Objects.requireNonNull(builder.factory, "factory");
    this.trigger = Objects.requireNonNull(builder.trigger, "trigger");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy
        : new ExponentialBackoffRetryPolicy(Duration.ofSeconds(1), Duration.ofHours(1));
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    if (builder.maxRetryAttempts < 0) {
      throw new IllegalArgumentException("maxRetryAttempts must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.precision.isNegative()) {
      throw new IllegalArgumentException("precision must be >= 0");
    }
    if (builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.maxRetryAttempts = builder.maxRetryAttempts;
    this.batchSize = builder.batchSize;
    this.precision = builder.precision;
    this.interval = builder.interval;
    this.lockTimeout = builder.lockTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled processing loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RecurringJobProcessor has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("recurrent-schedule-"));
    task = scheduler.scheduleWithFixedDelay(
        this::runOnce, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void runOnce() {
    if (closed) {
      return;
    }
    try {
      processOnce();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Recurring job processing cycle failed", t);
    }
  }

  /**
   * Processes every definition due at the current instant, up to {@code batchSize}.
   *
   * <p>May be invoked directly for testing or one-off runs.
   *
   * @return number of definitions processed; zero when another server holds the lock
   * @throws recurrent.RecurrentStoreException if the store fails
   */
  public int processOnce() {
    try {
      return connectionProvider.withConnection(conn -> {
        conn.setAutoCommit(true);
        try (DistributedLock.Handle ignored = lock.hold(conn, LOCK_RESOURCE, lockTimeout)) {
          Instant now = clock.instant();
          List<String> ids = store.dueIds(conn, now, batchSize);
          for (String id : ids) {
            process(conn, id, now);
          }
          return ids.size();
        }
      });
    } catch (DistributedLockTimeoutException e) {
      if (!LOCK_RESOURCE.equals(e.resource())) {
        throw e;
      }
      metrics.incrementLockContended(LOCK_RESOURCE);
      logger.log(Level.FINE, "Lock {0} is held by another server, skipping this cycle", LOCK_RESOURCE);
      return 0;
    }
  }

  private void process(Connection conn, String id, Instant now) {
    Map<String, String> fields = store.load(conn, id);
    if (fields.isEmpty()) {
      logger.log(Level.FINE, "Recurring job {0} no longer exists, dropping it from the index", id);
      store.remove(conn, id);
      return;
    }

    RecurringJobDefinition definition;
    try {
      definition = factory.create(id, fields, now);
    } catch (UnsupportedMisfireModeException e) {
      logger.log(Level.WARNING, "Recurring job " + id + " has an unsupported misfire option, disabling it", e);
      metrics.incrementDisabled();
      store.apply(conn, id, ChangeSet.of(
          Map.of(RecurringJobFields.NEXT_EXECUTION, "", RecurringJobFields.ERROR, describe(e)), null));
      return;
    }

    DueExecutions result = definition.computeDueExecutions(now, precision);
    if (!result.isSuccess()) {
      metrics.incrementScheduleFailures();
      store.apply(conn, id, onFailure(definition, result.error()));
      return;
    }

    try {
      for (Instant firedAt : result.due()) {
        String jobId = trigger.trigger(definition, firedAt);
        definition.recordExecution(firedAt, jobId);
      }
    } catch (RuntimeException e) {
      // instants triggered before the failure must not fire again on retry
      metrics.incrementScheduleFailures();
      store.apply(conn, id, withRecordedExecutions(definition, onFailure(definition, e)));
      return;
    }
    if (!result.due().isEmpty()) {
      metrics.incrementDueExecutions(result.due().size());
    }

    ChangeSet changes = definition.detectChanges();
    if (changes.hasChanges()) {
      store.apply(conn, id, changes);
    }
  }

  private ChangeSet onFailure(RecurringJobDefinition definition, Exception error) {
    if (definition.retryAttempt() < maxRetryAttempts) {
      Duration delay = retryPolicy.computeDelay(definition.retryAttempt() + 1);
      logger.log(Level.WARNING, "Recurring job " + definition.id() + " can not be scheduled, retry attempt "
          + (definition.retryAttempt() + 1) + " of " + maxRetryAttempts + " in " + delay, error);
      return definition.scheduleRetry(delay, describe(error));
    }
    logger.log(Level.WARNING, "Recurring job " + definition.id() + " can not be scheduled after "
        + maxRetryAttempts + " retry attempts, disabling it", error);
    metrics.incrementDisabled();
    return definition.disable(describe(error));
  }

  private static ChangeSet withRecordedExecutions(RecurringJobDefinition definition, ChangeSet failure) {
    Map<String, String> fields = new LinkedHashMap<>(definition.recordedExecutions());
    if (fields.isEmpty()) {
      return failure;
    }
    fields.putAll(failure.changedFields());
    return ChangeSet.of(fields, failure.nextExecution().orElse(null));
  }

  private static String describe(Exception error) {
    String message = error.getMessage();
    return message != null ? error.getClass().getName() + ": " + message : error.getClass().getName();
  }

  /** Cancels the processing schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RecurringJobProcessor}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private RecurringJobStore store;
    private DistributedLock lock;
    private RecurringJobFactory factory;
    private JobTrigger trigger;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private int maxRetryAttempts = 10;
    private int batchSize = 1000;
    private Duration precision = Duration.ofMinutes(1);
    private Duration interval = Duration.ofSeconds(15);
    private Duration lockTimeout = Duration.ofMinutes(1);

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder store(RecurringJobStore store) {
      this.store = store;
      return this;
    }

    /** <b>Required.</b> */
    public Builder lock(DistributedLock lock) {
      this.lock = lock;
      return this;
    }

    /** <b>Required.</b> */
    public Builder factory(RecurringJobFactory factory) {
      this.factory = factory;
      return this;
    }

    /**
     * Sets the callback that creates a background job for each due firing.
     *
     * <p><b>Required.</b>
     */
    public Builder trigger(JobTrigger trigger) {
      this.trigger = trigger;
      return this;
    }

    /**
     * Optional. Defaults to exponential backoff from 1 second up to 1 hour.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets how many consecutive failures are retried before a definition is disabled.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 0.
     */
    public Builder maxRetryAttempts(int maxRetryAttempts) {
      this.maxRetryAttempts = maxRetryAttempts;
      return this;
    }

    /** Optional. Defaults to {@code 1000}. Must be &gt; 0. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the trailing window in which {@link MisfireMode#IGNORABLE} definitions
     * still fire a missed instant.
     *
     * <p>Optional. Defaults to 1 minute.
     */
    public Builder precision(Duration precision) {
      this.precision = Objects.requireNonNull(precision, "precision");
      return this;
    }

    /** Optional. Defaults to 15 seconds. Must be &gt; 0. */
    public Builder interval(Duration interval) {
      this.interval = Objects.requireNonNull(interval, "interval");
      return this;
    }

    /** Optional. Defaults to 1 minute. */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public RecurringJobProcessor build() {
      return new RecurringJobProcessor(this);
    }
  }
}
