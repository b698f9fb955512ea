package recurrent.jdbc;

import recurrent.expiry.ExpiryCategory;

import java.util.Objects;

/**
 * Names of the store tables, all sharing a configurable prefix.
 *
 * <p>The default prefix {@value #DEFAULT_PREFIX} keeps names such as
 * {@code set} and {@code hash} clear of reserved words.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "recurrent_";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private static final TableNames DEFAULTS = new TableNames(DEFAULT_PREFIX);

  private final String prefix;

  private TableNames(String prefix) {
    this.prefix = prefix;
  }

  public static TableNames defaults() {
    return DEFAULTS;
  }

  /**
   * @throws IllegalArgumentException if the prefix would produce invalid table names
   */
  public static TableNames withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.isEmpty()) {
      validate(prefix);
    }
    return new TableNames(prefix);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  public String prefix() {
    return prefix;
  }

  public String expiry(ExpiryCategory category) {
    return prefix + category.tableSuffix();
  }

  public String job() {
    return expiry(ExpiryCategory.JOB);
  }

  public String hash() {
    return expiry(ExpiryCategory.HASH);
  }

  public String set() {
    return expiry(ExpiryCategory.SET);
  }

  public String state() {
    return prefix + "state";
  }

  public String lock() {
    return prefix + "lock";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TableNames other && prefix.equals(other.prefix);
  }

  @Override
  public int hashCode() {
    return prefix.hashCode();
  }

  @Override
  public String toString() {
    return "TableNames{prefix=" + prefix + '}';
  }
}
