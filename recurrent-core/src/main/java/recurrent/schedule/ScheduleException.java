package recurrent.schedule;

import java.util.List;

/**
 * Aggregates several errors collected while loading a recurring job. Each
 * collected error is attached as a suppressed exception, in collection order.
 */
public final class ScheduleException extends RuntimeException {

  ScheduleException(String recurringJobId, List<? extends Exception> errors) {
    super(errors.size() + " errors prevent scheduling recurring job '" + recurringJobId + "': "
        + describe(errors));
    errors.forEach(this::addSuppressed);
  }

  private static String describe(List<? extends Exception> errors) {
    StringBuilder sb = new StringBuilder();
    for (Exception error : errors) {
      if (sb.length() > 0) {
        sb.append("; ");
      }
      sb.append(error.getMessage());
    }
    return sb.toString();
  }
}
