package recurrent.expiry;

/**
 * Record kinds swept for expiry, in sweep order. Each names a table carrying
 * an {@code expire_at} column.
 */
public enum ExpiryCategory {
  COUNTER("aggregated_counter"),
  JOB("job"),
  LIST("list"),
  SET("set"),
  HASH("hash");

  private final String tableSuffix;

  ExpiryCategory(String tableSuffix) {
    this.tableSuffix = tableSuffix;
  }

  /**
   * Table name without the configured prefix; also used as the metrics tag.
   */
  public String tableSuffix() {
    return tableSuffix;
  }
}
