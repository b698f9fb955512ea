package recurrent.schedule;

/**
 * Thrown when a cron expression cannot be parsed.
 */
public final class CronFormatException extends IllegalArgumentException {
  public CronFormatException(String message) {
    super(message);
  }

  public CronFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
