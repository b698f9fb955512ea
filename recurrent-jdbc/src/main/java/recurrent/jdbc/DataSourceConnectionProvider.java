package recurrent.jdbc;

import recurrent.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} over a {@link DataSource}, usually a pool.
 *
 * <p>Sweeps and schedule updates run outside application transactions, so every
 * connection is handed out in auto-commit mode even if the pool returned it in
 * a different state.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection conn = dataSource.getConnection();
    try {
      if (!conn.getAutoCommit()) {
        conn.setAutoCommit(true);
      }
      return conn;
    } catch (SQLException e) {
      try {
        conn.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }
}
