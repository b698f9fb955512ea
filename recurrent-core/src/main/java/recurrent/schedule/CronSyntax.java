package recurrent.schedule;

import java.util.Objects;

/**
 * Field-count rules for recurring job cron expressions.
 *
 * <p>Five fields use minute granularity; six fields add a leading seconds field.
 * Fields are separated by spaces or tabs.
 */
public final class CronSyntax {

  private CronSyntax() {
  }

  /**
   * Converts an expression to its six-field, seconds-first form.
   *
   * @throws CronFormatException if the expression has neither five nor six fields
   */
  public static String toSixFields(String cronExpression) {
    Objects.requireNonNull(cronExpression, "cronExpression");
    String[] parts = cronExpression.trim().split("[ \t]+");
    if (parts.length == 6) {
      return String.join(" ", parts);
    }
    if (parts.length == 5) {
      return "0 " + String.join(" ", parts);
    }
    throw new CronFormatException("Wrong number of parts in the `" + cronExpression
        + "` cron expression, you can only use 5 or 6 (with seconds) part-based expressions.");
  }
}
