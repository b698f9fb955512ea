package recurrent.schedule;

/**
 * Thrown while loading a recurring job whose stored misfire option is not one of
 * the {@link MisfireMode} values. Unlike other malformed fields this is not
 * deferred: the definition cannot be constructed at all.
 */
public final class UnsupportedMisfireModeException extends IllegalArgumentException {
  private final String value;

  public UnsupportedMisfireModeException(String value) {
    super("Misfire option '" + value + "' is not supported.");
    this.value = value;
  }

  public String value() {
    return value;
  }
}
