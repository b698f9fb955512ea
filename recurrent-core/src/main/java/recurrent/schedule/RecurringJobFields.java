package recurrent.schedule;

/**
 * Names of the persisted fields of a recurring job.
 */
public final class RecurringJobFields {
  public static final String QUEUE = "Queue";
  public static final String CRON = "Cron";
  public static final String TIME_ZONE_ID = "TimeZoneId";
  public static final String JOB = "Job";
  public static final String CREATED_AT = "CreatedAt";
  public static final String LAST_EXECUTION = "LastExecution";
  public static final String NEXT_EXECUTION = "NextExecution";
  public static final String LAST_JOB_ID = "LastJobId";
  public static final String MISFIRE = "Misfire";
  public static final String VERSION = "V";
  public static final String ERROR = "Error";
  public static final String RETRY_ATTEMPT = "RetryAttempt";

  /** Schema version written on the first update of a definition that has none. */
  public static final String CURRENT_VERSION = "2";

  private RecurringJobFields() {
  }
}
