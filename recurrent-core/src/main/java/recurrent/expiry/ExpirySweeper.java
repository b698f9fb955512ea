package recurrent.expiry;

import recurrent.CancellationToken;
import recurrent.DistributedLockTimeoutException;
import recurrent.spi.ConnectionProvider;
import recurrent.spi.DistributedLock;
import recurrent.spi.ExpiryPurger;
import recurrent.spi.MetricsExporter;
import recurrent.util.DaemonThreadFactory;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background component that removes expired records from the shared store.
 *
 * <p>A pass visits every {@link ExpiryCategory} in declaration order and, when
 * a state retention is configured, the state history. Each category is swept
 * on its own connection under the distributed lock {@value #LOCK_RESOURCE}, so
 * only one server process sweeps a category at a time. Deletes are issued in
 * batches of {@code batchSize} rows until a batch comes back short.
 *
 * <p>Failing to obtain the lock within {@code lockTimeout} is not an error:
 * another process is sweeping, and the category is skipped for this pass.
 * Any other store failure propagates out of {@link #run(CancellationToken)}.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} runs passes
 * back to back on a daemon thread, waiting {@code interval} between them.
 *
 * @see ExpirySweeper.Builder
 * @see ExpiryPurger
 */
public final class ExpirySweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ExpirySweeper.class.getName());

  /** Name of the distributed lock guarding each category sweep. */
  public static final String LOCK_RESOURCE = "locks:expirationmanager";

  public static final int DEFAULT_BATCH_SIZE = 1000;
  public static final int MAX_BATCH_SIZE = 100_000;

  static final String STATE_LABEL = "state";

  private final ConnectionProvider connectionProvider;
  private final ExpiryPurger purger;
  private final DistributedLock lock;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int batchSize;
  private final Duration stateRetention;
  private final Duration interval;
  private final Duration lockTimeout;

  private final CancellationToken lifecycleToken = new CancellationToken();
  private ExecutorService executor;
  private Future<?> loop;
  private boolean closed;

  private ExpirySweeper(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.purger = Objects.requireNonNull(builder.purger, "purger");
    this.lock = Objects.requireNonNull(builder.lock, "lock");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    if (builder.stateRetention != null && builder.stateRetention.isNegative()) {
      throw new IllegalArgumentException("stateRetention must be >= 0");
    }
    if (builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    if (builder.lockTimeout.isNegative()) {
      throw new IllegalArgumentException("lockTimeout must be >= 0");
    }

    this.batchSize = effectiveBatchSize(builder.batchSize);
    this.stateRetention = builder.stateRetention != null ? builder.stateRetention : Duration.ZERO;
    this.interval = builder.interval;
    this.lockTimeout = builder.lockTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Batch sizes outside {@code (0, MAX_BATCH_SIZE]} fall back to {@value #DEFAULT_BATCH_SIZE}.
   */
  static int effectiveBatchSize(int requested) {
    return requested > 0 && requested <= MAX_BATCH_SIZE ? requested : DEFAULT_BATCH_SIZE;
  }

  public int batchSize() {
    return batchSize;
  }

  public Duration interval() {
    return interval;
  }

  /**
   * Runs one sweep pass and then waits for {@code interval}, returning early if
   * {@code token} is cancelled.
   *
   * @throws recurrent.RecurrentStoreException if the store fails for a reason other than lock contention
   */
  public void run(CancellationToken token) {
    Objects.requireNonNull(token, "token");
    sweepOnce(token);
    token.await(interval);
  }

  /**
   * Runs a single pass over every category without waiting afterwards. The
   * pass stops between categories once {@code token} is cancelled.
   *
   * <p>May be invoked directly for testing or one-off sweeps.
   *
   * @return total number of rows deleted
   */
  public long sweepOnce(CancellationToken token) {
    Objects.requireNonNull(token, "token");
    long total = 0;
    for (ExpiryCategory category : ExpiryCategory.values()) {
      if (token.isCancellationRequested()) {
        return total;
      }
      total += sweep(category.tableSuffix(), token,
          (conn, now) -> purger.purgeExpired(conn, category, now, batchSize, token));
    }
    if (!stateRetention.isZero() && !token.isCancellationRequested()) {
      total += sweep(STATE_LABEL, token,
          (conn, now) -> purger.purgeStateHistory(conn, now.minus(stateRetention), batchSize, token));
    }
    return total;
  }

  private long sweep(String label, CancellationToken token, BatchDelete batch) {
    try {
      return connectionProvider.withConnection(conn -> {
        conn.setAutoCommit(true);
        try (DistributedLock.Handle ignored = lock.hold(conn, LOCK_RESOURCE, lockTimeout)) {
          Instant now = clock.instant();
          long removed = 0;
          int affected;
          do {
            affected = batch.delete(conn, now);
            removed += affected;
            logger.log(Level.FINE, "Deleted {0} expired records from {1}", new Object[]{affected, label});
          } while (affected == batchSize && !token.isCancellationRequested());

          if (removed > 0) {
            metrics.incrementExpiredDeleted(label, removed);
            logger.log(Level.INFO, "Removed {0} outdated records from the {1} table",
                new Object[]{removed, label});
          }
          return removed;
        }
      });
    } catch (DistributedLockTimeoutException e) {
      if (!LOCK_RESOURCE.equals(e.resource())) {
        throw e;
      }
      metrics.incrementLockContended(LOCK_RESOURCE);
      logger.log(Level.FINE, "Lock {0} is held by another server, skipping the {1} table for this pass",
          new Object[]{LOCK_RESOURCE, label});
      return 0;
    }
  }

  /**
   * Starts the background loop on a daemon thread. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the sweeper has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ExpirySweeper has been closed");
    }
    if (loop != null) {
      return;
    }
    executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("recurrent-expiry-"));
    loop = executor.submit(this::loop);
  }

  private void loop() {
    while (!lifecycleToken.isCancellationRequested()) {
      try {
        run(lifecycleToken);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Expiry sweep failed, retrying after " + interval, e);
        lifecycleToken.await(interval);
      }
    }
  }

  /** Cancels any in-flight sweep and stops the background thread. */
  @Override
  public synchronized void close() {
    closed = true;
    lifecycleToken.cancel();
    if (loop != null) {
      loop.cancel(false);
      loop = null;
    }
    if (executor != null) {
      executor.shutdownNow();
      try {
        executor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  @FunctionalInterface
  private interface BatchDelete {
    int delete(Connection conn, Instant now);
  }

  /** Builder for {@link ExpirySweeper}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ExpiryPurger purger;
    private DistributedLock lock;
    private MetricsExporter metrics;
    private Clock clock;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private Duration stateRetention;
    private Duration interval = Duration.ofMinutes(30);
    private Duration lockTimeout = Duration.ofMinutes(5);

    private Builder() {}

    /**
     * Sets the connection provider used for each category sweep.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store-specific delete implementation.
     *
     * <p><b>Required.</b>
     */
    public Builder purger(ExpiryPurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Sets the distributed lock shared with the other server processes.
     *
     * <p><b>Required.</b>
     */
    public Builder lock(DistributedLock lock) {
      this.lock = lock;
      return this;
    }

    /**
     * Sets the maximum number of rows deleted per statement.
     *
     * <p>Optional. Defaults to {@code 1000}. Values outside {@code (0, 100000]}
     * fall back to the default.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets how long superseded state history is kept. Zero disables the state sweep.
     *
     * <p>Optional. Defaults to zero. Must be &ge; 0.
     */
    public Builder stateRetention(Duration stateRetention) {
      this.stateRetention = stateRetention;
      return this;
    }

    /**
     * Sets the wait between passes.
     *
     * <p>Optional. Defaults to 30 minutes. Must be &gt; 0.
     */
    public Builder interval(Duration interval) {
      this.interval = Objects.requireNonNull(interval, "interval");
      return this;
    }

    /**
     * Sets how long to wait for the distributed lock before skipping a category.
     *
     * <p>Optional. Defaults to 5 minutes.
     */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the system UTC clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws NullPointerException if {@code connectionProvider}, {@code purger} or {@code lock} is null
     * @throws IllegalArgumentException if {@code stateRetention} or {@code lockTimeout} is negative,
     *     or {@code interval} is not positive
     */
    public ExpirySweeper build() {
      return new ExpirySweeper(this);
    }
  }
}
