package recurrent.schedule;

import java.util.Locale;

/**
 * How a recurring job treats firings that were missed because "now" advanced past them.
 */
public enum MisfireMode {
  /** Collapse every missed firing into a single firing at the current instant. */
  RELAXED(0),
  /** Replay every missed firing at its original instant, oldest first. */
  STRICT(1),
  /** Fire a missed instant only within the trailing precision window; drop older ones. */
  IGNORABLE(2);

  private final int code;

  MisfireMode(int code) {
    this.code = code;
  }

  /**
   * Persisted numeric code.
   */
  public int code() {
    return code;
  }

  /**
   * Parses a persisted value, either the numeric code or the constant name (case-insensitive).
   *
   * @throws UnsupportedMisfireModeException if the value names no known mode
   */
  public static MisfireMode parse(String value) {
    String trimmed = value == null ? "" : value.trim();
    for (MisfireMode mode : values()) {
      if (trimmed.equals(Integer.toString(mode.code))
          || trimmed.toUpperCase(Locale.ROOT).equals(mode.name())) {
        return mode;
      }
    }
    throw new UnsupportedMisfireModeException(value);
  }
}
