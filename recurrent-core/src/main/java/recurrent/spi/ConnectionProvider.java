package recurrent.spi;

import recurrent.RecurrentStoreException;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the shared store.
 *
 * <p>Prefer {@link #withConnection(ConnectionCallback)}, which scopes the
 * connection to the callback and always closes it.
 *
 * @see recurrent.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;

    /**
     * Runs {@code action} with a freshly acquired connection and releases the
     * connection on every exit path.
     *
     * @param action the work to perform
     * @param <T>    result type
     * @return the callback's result
     * @throws RecurrentStoreException if the connection cannot be obtained or closed
     */
    default <T> T withConnection(ConnectionCallback<T> action) {
        try (Connection conn = getConnection()) {
            return action.doInConnection(conn);
        } catch (SQLException e) {
            throw new RecurrentStoreException("Failed to use store connection", e);
        }
    }

    /**
     * Work executed against a scoped connection.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    interface ConnectionCallback<T> {
        T doInConnection(Connection conn) throws SQLException;
    }
}
