package recurrent.jdbc;

import recurrent.RecurrentStoreException;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void nullDataSourceThrows() {
    assertThrows(NullPointerException.class, () ->
        new DataSourceConnectionProvider(null));
  }

  @Test
  void delegatesToDataSource() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dscp_test;DB_CLOSE_DELAY=-1");

    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);

    try (Connection conn = provider.getConnection()) {
      assertNotNull(conn);
      assertFalse(conn.isClosed());
    }
  }

  @Test
  void handsOutAutoCommitConnections() throws SQLException {
    SimpleDataSource pool = new SimpleDataSource("jdbc:h2:mem:dscp_autocommit;DB_CLOSE_DELAY=-1", "sa", "")
        .withAutoCommitOff();
    try (Connection raw = pool.getConnection()) {
      assertFalse(raw.getAutoCommit());
    }
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(pool);

    assertSame(pool, provider.dataSource());
    try (Connection conn = provider.getConnection()) {
      assertTrue(conn.getAutoCommit());
    }
  }

  @Test
  void withConnectionClosesConnectionAfterCallback() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dscp_scoped;DB_CLOSE_DELAY=-1");
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);
    AtomicReference<Connection> used = new AtomicReference<>();

    int result = provider.withConnection(conn -> {
      used.set(conn);
      return 42;
    });

    assertEquals(42, result);
    assertDoesNotThrow(() -> assertTrue(used.get().isClosed()));
  }

  @Test
  void withConnectionWrapsSqlFailures() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dscp_failure;DB_CLOSE_DELAY=-1");
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);

    RecurrentStoreException ex = assertThrows(RecurrentStoreException.class, () ->
        provider.withConnection(conn -> conn.createStatement().execute("SELECT * FROM missing_table")));
    assertInstanceOf(SQLException.class, ex.getCause());
  }
}
