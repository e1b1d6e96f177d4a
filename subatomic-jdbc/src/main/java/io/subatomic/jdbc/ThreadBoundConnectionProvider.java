package io.subatomic.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConnectionProvider} that binds one {@link DataSource} connection to each thread.
 *
 * <p>The connection is obtained on first use and kept until {@link #release()} is called on the
 * same thread. Release it when the thread's unit of work is done, outside any transaction.
 */
public final class ThreadBoundConnectionProvider implements ConnectionProvider {
    private static final Logger logger = Logger.getLogger(ThreadBoundConnectionProvider.class.getName());

    private final DataSource dataSource;
    private final ThreadLocal<Connection> current = new ThreadLocal<>();

    public ThreadBoundConnectionProvider(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public Connection getConnection() throws SQLException {
        Connection connection = current.get();
        if (connection == null || connection.isClosed()) {
            connection = dataSource.getConnection();
            current.set(connection);
        }
        return connection;
    }

    @Override
    public boolean hasConnection() {
        return current.get() != null;
    }

    @Override
    public void release() {
        Connection connection = current.get();
        if (connection == null) {
            return;
        }
        current.remove();
        logger.log(Level.FINE, "Releasing thread-bound connection");
        try {
            connection.close();
        } catch (SQLException e) {
            throw new TransactionBackendException("Failed to close connection", e);
        }
    }
}
