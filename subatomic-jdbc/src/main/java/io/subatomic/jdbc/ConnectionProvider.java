package io.subatomic.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies the JDBC connection that a {@link JdbcTransactionBackend} drives.
 *
 * <p>Every call on the same thread must return the same connection until {@link #release()},
 * since transaction state lives on the connection. The returned connection is owned by the
 * provider; callers must not close it.
 *
 * @see ThreadBoundConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Returns the connection of the calling thread, obtaining one if needed.
     *
     * @return an open connection owned by this provider
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;

    /**
     * Returns {@code true} if the calling thread already holds a connection.
     * Used to answer state queries without opening one.
     */
    default boolean hasConnection() {
        return true;
    }

    /**
     * Gives back the calling thread's connection, if any.
     */
    default void release() {
    }
}
