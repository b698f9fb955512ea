package recurrent.schedule;

import java.time.Instant;
import java.util.List;

/**
 * Result of {@link RecurringJobDefinition#computeDueExecutions}: the instants
 * to trigger now, in order, and the error that stopped scheduling, if any.
 *
 * <p>A non-null {@code error} means nothing must be triggered; {@code due}
 * may still hold instants found before the failure.
 */
public record DueExecutions(List<Instant> due, Exception error) {

  public DueExecutions {
    due = List.copyOf(due);
  }

  static DueExecutions failed(Exception error) {
    return new DueExecutions(List.of(), error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
