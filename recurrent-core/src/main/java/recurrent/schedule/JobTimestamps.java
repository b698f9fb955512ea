package recurrent.schedule;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Text form of instants stored on recurring jobs: ISO-8601 in UTC. Rows written
 * by older versions stored epoch milliseconds, which are still accepted.
 */
public final class JobTimestamps {

  private JobTimestamps() {
  }

  /** Millisecond precision; finer fractions of the system clock are dropped. */
  public static String serialize(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MILLIS).toString();
  }

  /**
   * @throws DateTimeParseException if the text is neither ISO-8601 nor epoch milliseconds
   */
  public static Instant deserialize(String text) {
    String trimmed = text.trim();
    if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
      try {
        return Instant.ofEpochMilli(Long.parseLong(trimmed));
      } catch (NumberFormatException e) {
        throw new DateTimeParseException("Epoch milliseconds out of range", trimmed, 0, e);
      }
    }
    return Instant.parse(trimmed);
  }
}
