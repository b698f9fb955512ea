package recurrent.jdbc.purge;

import recurrent.jdbc.TableNames;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC expiry purgers with auto-detection support.
 *
 * <p>Purgers are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/recurrent.jdbc.purge.AbstractJdbcExpiryPurger}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcExpiryPurger purger = JdbcExpiryPurgers.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, with prefixed table names
 * AbstractJdbcExpiryPurger purger = JdbcExpiryPurgers.detect("jdbc:mysql://localhost/jobs")
 *     .withTableNames(TableNames.withPrefix("jobs_"));
 *
 * // Get by name
 * AbstractJdbcExpiryPurger purger = JdbcExpiryPurgers.get("postgresql");
 * }</pre>
 */
public final class JdbcExpiryPurgers {

  private static final List<AbstractJdbcExpiryPurger> PURGERS;
  private static final Map<String, AbstractJdbcExpiryPurger> BY_NAME = new ConcurrentHashMap<>();

  static {
    PURGERS = ServiceLoader.load(AbstractJdbcExpiryPurger.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcExpiryPurger purger : PURGERS) {
      BY_NAME.put(purger.name().toLowerCase(Locale.ROOT), purger);
    }
  }

  private JdbcExpiryPurgers() {
  }

  /**
   * Returns all registered purgers.
   */
  public static List<AbstractJdbcExpiryPurger> all() {
    return PURGERS;
  }

  /**
   * Gets a purger by name.
   *
   * @param name purger name (case-insensitive)
   * @throws IllegalArgumentException if no purger is registered under that name
   */
  public static AbstractJdbcExpiryPurger get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcExpiryPurger purger = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (purger == null) {
      throw new IllegalArgumentException("Unknown expiry purger: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return purger;
  }

  /**
   * Auto-detects the purger from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no purger matches
   */
  public static AbstractJdbcExpiryPurger detect(DataSource dataSource) {
    return detect(jdbcUrl(dataSource));
  }

  /**
   * Auto-detects the purger from a DataSource and binds it to {@code tableNames}.
   */
  public static AbstractJdbcExpiryPurger detect(DataSource dataSource, TableNames tableNames) {
    return detect(dataSource).withTableNames(tableNames);
  }

  /**
   * Auto-detects the purger from a JDBC URL.
   *
   * @throws IllegalArgumentException if no matching purger is registered
   */
  public static AbstractJdbcExpiryPurger detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String normalized = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcExpiryPurger purger : PURGERS) {
      for (String prefix : purger.jdbcUrlPrefixes()) {
        if (normalized.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return purger;
        }
      }
    }

    throw new IllegalArgumentException("No expiry purger found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Reads the JDBC URL of a DataSource from its connection metadata.
   *
   * @throws IllegalStateException if no connection can be obtained
   */
  public static String jdbcUrl(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read JDBC URL from DataSource", e);
    }
  }

  private static List<String> allPrefixes() {
    return PURGERS.stream()
        .flatMap(p -> p.jdbcUrlPrefixes().stream())
        .toList();
  }
}
