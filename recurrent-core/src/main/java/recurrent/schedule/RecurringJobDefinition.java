package recurrent.schedule;

import recurrent.model.JobInvocation;
import recurrent.spi.CronEvaluator;
import recurrent.spi.JobPayloadCodec;
import recurrent.spi.TimeZoneResolver;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static recurrent.schedule.RecurringJobFields.CREATED_AT;
import static recurrent.schedule.RecurringJobFields.CRON;
import static recurrent.schedule.RecurringJobFields.CURRENT_VERSION;
import static recurrent.schedule.RecurringJobFields.ERROR;
import static recurrent.schedule.RecurringJobFields.JOB;
import static recurrent.schedule.RecurringJobFields.LAST_EXECUTION;
import static recurrent.schedule.RecurringJobFields.LAST_JOB_ID;
import static recurrent.schedule.RecurringJobFields.MISFIRE;
import static recurrent.schedule.RecurringJobFields.NEXT_EXECUTION;
import static recurrent.schedule.RecurringJobFields.QUEUE;
import static recurrent.schedule.RecurringJobFields.RETRY_ATTEMPT;
import static recurrent.schedule.RecurringJobFields.TIME_ZONE_ID;
import static recurrent.schedule.RecurringJobFields.VERSION;

/**
 * A recurring job definition loaded from its stored field snapshot.
 *
 * <p>Instances are built fresh from a snapshot and the current instant every
 * time they are needed, and hold no identity beyond the stored row. Malformed
 * fields (time zone, job payload, timestamps) do not stop construction; they are
 * collected in {@link #errors()} and reported by {@link #computeDueExecutions}.
 * An unknown misfire option is the exception: construction throws
 * {@link UnsupportedMisfireModeException}.
 *
 * <p>Callers persist only the fields reported by {@link #detectChanges()},
 * {@link #scheduleRetry} or {@link #disable}; the definition is never written
 * as a whole.
 *
 * <p>Instances are not thread-safe.
 *
 * @see RecurringJobFactory
 */
public final class RecurringJobDefinition {
  /** Zone used when a definition stores no time zone. */
  public static final ZoneId DEFAULT_TIME_ZONE = ZoneId.of("UTC");

  private final String id;
  private final RecurringJobSnapshot snapshot;
  private final CronEvaluator cronEvaluator;
  private final JobPayloadCodec payloadCodec;
  private final ZoneId defaultTimeZone;
  private final Instant now;
  private final List<Exception> errors = new ArrayList<>();

  private final Instant createdAt;
  private final Integer version;

  private String queue;
  private String cronExpression;
  private ZoneId timeZone;
  private JobInvocation job;
  private MisfireMode misfireMode;
  private Instant lastExecution;
  private Instant nextExecution;
  private String lastJobId;
  private int retryAttempt;

  RecurringJobDefinition(
      String id,
      RecurringJobSnapshot snapshot,
      TimeZoneResolver timeZoneResolver,
      JobPayloadCodec payloadCodec,
      CronEvaluator cronEvaluator,
      ZoneId defaultTimeZone,
      Instant now) {
    Objects.requireNonNull(id, "id");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id must not be empty");
    }
    Objects.requireNonNull(timeZoneResolver, "timeZoneResolver");
    this.id = id;
    this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
    this.cronEvaluator = Objects.requireNonNull(cronEvaluator, "cronEvaluator");
    this.defaultTimeZone = Objects.requireNonNull(defaultTimeZone, "defaultTimeZone");
    this.now = Objects.requireNonNull(now, "now");

    this.queue = snapshot.field(QUEUE).valueOrNull();
    this.cronExpression = snapshot.field(CRON).valueOrNull();
    this.timeZone = loadTimeZone(timeZoneResolver);
    this.job = loadJob();
    this.lastJobId = snapshot.field(LAST_JOB_ID).valueOrNull();
    this.lastExecution = loadInstant(LAST_EXECUTION);
    this.nextExecution = loadInstant(NEXT_EXECUTION);
    Instant storedCreatedAt = loadInstant(CREATED_AT);
    this.createdAt = storedCreatedAt != null ? storedCreatedAt : now;

    String misfire = snapshot.raw(MISFIRE);
    this.misfireMode = snapshot.contains(MISFIRE) ? MisfireMode.parse(misfire) : MisfireMode.RELAXED;

    this.version = loadVersion();
    this.retryAttempt = loadRetryAttempt();
  }

  public String id() {
    return id;
  }

  public String queue() {
    return queue;
  }

  public void queue(String queue) {
    this.queue = queue;
  }

  public String cronExpression() {
    return cronExpression;
  }

  public void cronExpression(String cronExpression) {
    this.cronExpression = cronExpression;
  }

  public ZoneId timeZone() {
    return timeZone;
  }

  public void timeZone(ZoneId timeZone) {
    this.timeZone = Objects.requireNonNull(timeZone, "timeZone");
  }

  public JobInvocation job() {
    return job;
  }

  public void job(JobInvocation job) {
    this.job = Objects.requireNonNull(job, "job");
  }

  public MisfireMode misfireMode() {
    return misfireMode;
  }

  public void misfireMode(MisfireMode misfireMode) {
    this.misfireMode = Objects.requireNonNull(misfireMode, "misfireMode");
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Optional<Instant> lastExecution() {
    return Optional.ofNullable(lastExecution);
  }

  public Optional<Instant> nextExecution() {
    return Optional.ofNullable(nextExecution);
  }

  public Optional<String> lastJobId() {
    return Optional.ofNullable(lastJobId);
  }

  public Optional<Integer> version() {
    return Optional.ofNullable(version);
  }

  public int retryAttempt() {
    return retryAttempt;
  }

  /**
   * Errors collected while reading the snapshot, in the order they occurred.
   */
  public List<Exception> errors() {
    return List.copyOf(errors);
  }

  /**
   * Records that the job fired at {@code firedAt} and created job {@code jobId}.
   */
  public void recordExecution(Instant firedAt, String jobId) {
    this.lastExecution = Objects.requireNonNull(firedAt, "firedAt");
    this.lastJobId = jobId;
  }

  /**
   * {@code LastExecution} and {@code LastJobId} values that differ from the
   * snapshot because of {@link #recordExecution}; empty when nothing fired.
   */
  Map<String, String> recordedExecutions() {
    Map<String, String> result = new LinkedHashMap<>();
    String serializedLastExecution = lastExecution == null ? null : JobTimestamps.serialize(lastExecution);
    if (serializedLastExecution != null && !serializedLastExecution.equals(snapshot.raw(LAST_EXECUTION))) {
      result.put(LAST_EXECUTION, serializedLastExecution);
      result.put(LAST_JOB_ID, lastJobId == null ? "" : lastJobId);
    }
    return result;
  }

  /**
   * Computes the instants that are due at {@code now} and the next expected
   * firing, reconciling missed firings with the definition's misfire mode.
   *
   * <p>The walk starts at the last execution, or one second before creation,
   * and repeatedly asks for the next occurrence strictly after the current
   * point. Occurrences equal to {@code now} are due. Missed occurrences are
   * handled per {@link MisfireMode}: RELAXED emits {@code now} once and
   * continues from it; STRICT emits each missed instant; IGNORABLE emits a
   * missed instant only inside {@code [now - precision, now]}. The first future
   * occurrence becomes {@link #nextExecution()}, which is updated on every call.
   *
   * <p>STRICT replays every missed instant however long the outage was.
   *
   * @param now       the current instant
   * @param precision trailing window for IGNORABLE misfires
   * @return due instants in order, or the error that prevents scheduling
   */
  public DueExecutions computeDueExecutions(Instant now, Duration precision) {
    Objects.requireNonNull(now, "now");
    Objects.requireNonNull(precision, "precision");
    if (!errors.isEmpty()) {
      return DueExecutions.failed(errors.size() == 1 ? errors.get(0) : new ScheduleException(id, errors));
    }

    List<Instant> due = new ArrayList<>();
    Instant windowStart = now.minus(precision);
    Instant candidate = null;
    while (true) {
      Optional<Instant> next;
      try {
        next = nextOccurrence(candidate);
      } catch (RuntimeException e) {
        nextExecution = null;
        return new DueExecutions(due, e);
      }
      if (next.isEmpty() || next.get().isAfter(now)) {
        candidate = next.orElse(null);
        break;
      }
      candidate = next.get();
      if (candidate.equals(now)) {
        due.add(candidate);
        continue;
      }
      switch (misfireMode) {
        case RELAXED -> {
          candidate = now;
          due.add(now);
        }
        case STRICT -> due.add(candidate);
        case IGNORABLE -> {
          if (!candidate.isBefore(windowStart)) {
            due.add(candidate);
          }
        }
      }
    }

    nextExecution = candidate;
    return new DueExecutions(due, null);
  }

  /**
   * Compares the definition with its snapshot and returns the minimal set of fields to rewrite.
   *
   * <p>A next execution computed by {@link #computeDueExecutions} that differs
   * from the stored one is written as is. Otherwise it is recomputed: from one
   * second before now when the cron expression or time zone changed, so an
   * edited definition behaves as if it just became active, and from the last
   * execution otherwise. Any write also stamps the schema version when none is
   * stored, clears a stored error and resets a non-zero retry counter.
   */
  public ChangeSet detectChanges() {
    Map<String, String> result = new LinkedHashMap<>();

    putIfDifferent(result, QUEUE, queue);
    putIfDifferent(result, CRON, cronExpression);
    putIfDifferent(result, TIME_ZONE_ID, timeZone.getId());
    putIfDifferent(result, JOB, job == null ? null : payloadCodec.serialize(job));
    putIfDifferent(result, CREATED_AT, JobTimestamps.serialize(createdAt));

    String serializedLastExecution = lastExecution == null ? null : JobTimestamps.serialize(lastExecution);
    if (!Objects.equals(snapshot.raw(LAST_EXECUTION), serializedLastExecution)) {
      result.put(LAST_EXECUTION, serializedLastExecution == null ? "" : serializedLastExecution);
    }

    String storedTimeZoneId = snapshot.contains(TIME_ZONE_ID) ? snapshot.raw(TIME_ZONE_ID).trim() : defaultTimeZone.getId();
    boolean timeZoneChanged = !timeZone.getId().equals(storedTimeZoneId);

    Instant newNextExecution;
    String serializedNextExecution = nextExecution == null ? null : JobTimestamps.serialize(nextExecution);
    if (serializedNextExecution != null && !serializedNextExecution.equals(snapshot.raw(NEXT_EXECUTION))) {
      result.put(NEXT_EXECUTION, serializedNextExecution);
      newNextExecution = nextExecution;
    } else {
      Instant origin = result.containsKey(CRON) || timeZoneChanged ? now.minusSeconds(1) : null;
      newNextExecution = tryNextOccurrence(origin);
      serializedNextExecution = newNextExecution == null ? null : JobTimestamps.serialize(newNextExecution);
      if (!Objects.equals(snapshot.raw(NEXT_EXECUTION), serializedNextExecution)) {
        result.put(NEXT_EXECUTION, serializedNextExecution == null ? "" : serializedNextExecution);
      }
    }

    if (!Objects.equals(snapshot.raw(LAST_JOB_ID), lastJobId)) {
      result.put(LAST_JOB_ID, lastJobId == null ? "" : lastJobId);
    }

    String misfireCode = Integer.toString(misfireMode.code());
    if ((!snapshot.contains(MISFIRE) && misfireMode != MisfireMode.RELAXED)
        || (snapshot.contains(MISFIRE) && !misfireCode.equals(snapshot.raw(MISFIRE)))) {
      result.put(MISFIRE, misfireCode);
    }

    stampVersion(result);

    String storedError = snapshot.raw(ERROR);
    if (storedError != null && !storedError.isEmpty()) {
      result.put(ERROR, "");
    }

    if (snapshot.contains(RETRY_ATTEMPT) && !"0".equals(snapshot.raw(RETRY_ATTEMPT))) {
      result.put(RETRY_ATTEMPT, "0");
    }

    boolean changed = !result.isEmpty() || !Objects.equals(newNextExecution, nextExecution);
    return new ChangeSet(result, newNextExecution, changed);
  }

  /**
   * Postpones the definition after a transient failure: increments the retry
   * counter and moves the next execution to the construction instant plus {@code delay}.
   *
   * @param delay delay before the schedule is recomputed
   * @param error error text to record; {@code null} clears it
   */
  public ChangeSet scheduleRetry(Duration delay, String error) {
    Objects.requireNonNull(delay, "delay");
    retryAttempt++;
    nextExecution = now.plus(delay);

    Map<String, String> result = new LinkedHashMap<>();
    result.put(RETRY_ATTEMPT, Integer.toString(retryAttempt));
    result.put(ERROR, error == null ? "" : error);
    stampVersion(result);
    return new ChangeSet(result, nextExecution, true);
  }

  /**
   * Removes the definition from due polling after an unrecoverable failure,
   * recording the error for operators.
   *
   * @param error error text to record; {@code null} clears it
   */
  public ChangeSet disable(String error) {
    nextExecution = null;

    Map<String, String> result = new LinkedHashMap<>();
    result.put(NEXT_EXECUTION, "");
    result.put(ERROR, error == null ? "" : error);
    stampVersion(result);
    return new ChangeSet(result, null, true);
  }

  @Override
  public String toString() {
    return "RecurringJobDefinition{id=" + id + ", " + snapshot + '}';
  }

  /**
   * Evaluates the cron expression once so syntax errors surface to the caller.
   *
   * @throws CronFormatException if the expression is missing or malformed
   */
  void validateCron() {
    nextOccurrence(now);
  }

  private Optional<Instant> nextOccurrence(Instant from) {
    if (cronExpression == null) {
      throw new CronFormatException("The '" + CRON + "' field of recurring job '" + id + "' has a null or empty value");
    }
    Instant origin = from != null ? from : lastExecution != null ? lastExecution : createdAt.minusSeconds(1);
    return cronEvaluator.nextOccurrence(CronSyntax.toSixFields(cronExpression), origin, timeZone);
  }

  private Instant tryNextOccurrence(Instant from) {
    try {
      return nextOccurrence(from).orElse(null);
    } catch (RuntimeException e) {
      return null;
    }
  }

  private void putIfDifferent(Map<String, String> result, String field, String value) {
    if (!Objects.equals(snapshot.raw(field), value)) {
      result.put(field, value);
    }
  }

  private void stampVersion(Map<String, String> result) {
    if (!snapshot.contains(VERSION)) {
      result.put(VERSION, CURRENT_VERSION);
    }
  }

  private ZoneId loadTimeZone(TimeZoneResolver resolver) {
    String zoneId = snapshot.field(TIME_ZONE_ID).valueOrNull();
    if (zoneId == null) {
      return defaultTimeZone;
    }
    try {
      return resolver.resolve(zoneId);
    } catch (RuntimeException e) {
      errors.add(e);
      return defaultTimeZone;
    }
  }

  private JobInvocation loadJob() {
    String payload = snapshot.field(JOB).valueOrNull();
    if (payload == null) {
      errors.add(new IllegalStateException("The '" + JOB + "' field has a null or empty value"));
      return null;
    }
    try {
      return payloadCodec.deserialize(payload);
    } catch (RuntimeException e) {
      errors.add(e);
      return null;
    }
  }

  private Instant loadInstant(String field) {
    String text = snapshot.field(field).valueOrNull();
    if (text == null) {
      return null;
    }
    try {
      return JobTimestamps.deserialize(text);
    } catch (RuntimeException e) {
      errors.add(e);
      return null;
    }
  }

  private Integer loadVersion() {
    String text = snapshot.field(VERSION).valueOrNull();
    if (text == null) {
      return null;
    }
    try {
      return Integer.valueOf(text.trim());
    } catch (NumberFormatException e) {
      errors.add(e);
      return null;
    }
  }

  private int loadRetryAttempt() {
    String text = snapshot.field(RETRY_ATTEMPT).valueOrNull();
    if (text == null) {
      return 0;
    }
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
