package recurrent.schedule;

import recurrent.model.JobInvocation;
import recurrent.spi.ConnectionProvider;
import recurrent.spi.DistributedLock;
import recurrent.spi.RecurringJobStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates, updates and removes recurring job definitions.
 *
 * <p>Updates go through {@link RecurringJobDefinition#detectChanges()}, so only
 * the fields that differ from the stored definition are written. Each call
 * holds the per-definition lock {@code recurring-job:<id>}.
 */
public final class RecurringJobManager {
  private static final Logger logger = Logger.getLogger(RecurringJobManager.class.getName());

  static final String LOCK_PREFIX = "recurring-job:";

  private final ConnectionProvider connectionProvider;
  private final RecurringJobStore store;
  private final DistributedLock lock;
  private final RecurringJobFactory factory;
  private final Clock clock;
  private final Duration lockTimeout;

  private RecurringJobManager(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.lock = Objects.requireNonNull(builder.lock, "lock");
    this.factory = Objects.requireNonNull(builder.factory, "factory");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.lockTimeout = builder.lockTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean addOrUpdate(String id, JobInvocation job, String cronExpression) {
    return addOrUpdate(id, job, cronExpression, null, null, MisfireMode.RELAXED);
  }

  /**
   * Stores the definition, writing only the fields that changed.
   *
   * <p>Changing the cron expression or time zone restarts the schedule from the
   * current instant; otherwise the stored execution history is kept.
   *
   * @param zone  evaluation zone; {@code null} keeps the stored zone or the default one
   * @param queue target queue; {@code null} for the default queue
   * @return {@code true} if anything was written
   * @throws CronFormatException if the cron expression is malformed
   */
  public boolean addOrUpdate(String id, JobInvocation job, String cronExpression, ZoneId zone,
      String queue, MisfireMode misfireMode) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(job, "job");
    Objects.requireNonNull(cronExpression, "cronExpression");
    Objects.requireNonNull(misfireMode, "misfireMode");

    return connectionProvider.withConnection(conn -> {
      conn.setAutoCommit(true);
      try (DistributedLock.Handle ignored = lock.hold(conn, LOCK_PREFIX + id, lockTimeout)) {
        Instant now = clock.instant();
        RecurringJobDefinition definition = factory.create(id, store.load(conn, id), now);
        definition.job(job);
        definition.cronExpression(cronExpression);
        if (zone != null) {
          definition.timeZone(zone);
        }
        definition.queue(queue);
        definition.misfireMode(misfireMode);
        definition.validateCron();

        ChangeSet changes = definition.detectChanges();
        if (!changes.hasChanges()) {
          return false;
        }
        store.apply(conn, id, changes);
        logger.log(Level.FINE, "Stored recurring job {0}: {1}", new Object[]{id, changes});
        return true;
      }
    });
  }

  /**
   * @return {@code true} if the definition existed
   */
  public boolean remove(String id) {
    Objects.requireNonNull(id, "id");
    return connectionProvider.withConnection(conn -> {
      conn.setAutoCommit(true);
      try (DistributedLock.Handle ignored = lock.hold(conn, LOCK_PREFIX + id, lockTimeout)) {
        return store.remove(conn, id);
      }
    });
  }

  /** Builder for {@link RecurringJobManager}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private RecurringJobStore store;
    private DistributedLock lock;
    private RecurringJobFactory factory;
    private Clock clock;
    private Duration lockTimeout = Duration.ofSeconds(15);

    private Builder() {}

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder store(RecurringJobStore store) {
      this.store = store;
      return this;
    }

    public Builder lock(DistributedLock lock) {
      this.lock = lock;
      return this;
    }

    public Builder factory(RecurringJobFactory factory) {
      this.factory = factory;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      return this;
    }

    public RecurringJobManager build() {
      return new RecurringJobManager(this);
    }
  }
}
