package io.subatomic.jdbc;

import io.subatomic.spi.TransactionBackend;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TransactionBackend} issuing transaction control on a JDBC connection.
 *
 * <p>Transactions are delimited with {@link Connection#setAutoCommit(boolean)}. Savepoints are
 * named JDBC {@link Savepoint}s, tracked per thread by name until released, rolled back to,
 * or dropped with their transaction.
 */
public final class JdbcTransactionBackend implements TransactionBackend {
    private final ConnectionProvider connectionProvider;
    private final ThreadLocal<Map<String, Savepoint>> savepoints = ThreadLocal.withInitial(HashMap::new);

    public JdbcTransactionBackend(ConnectionProvider connectionProvider) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    }

    public ConnectionProvider connectionProvider() {
        return connectionProvider;
    }

    @Override
    public void begin() {
        try {
            connection().setAutoCommit(false);
        } catch (SQLException e) {
            throw new TransactionBackendException("Failed to begin transaction", e);
        }
    }

    @Override
    public void commit() {
        try {
            Connection connection = connection();
            connection.commit();
            savepoints.remove();
            // Left in manual-commit mode on failure so the caller can still roll back.
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw new TransactionBackendException("Failed to commit transaction", e);
        }
    }

    @Override
    public void rollback() {
        try {
            Connection connection = connection();
            try {
                connection.rollback();
            } finally {
                savepoints.remove();
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new TransactionBackendException("Failed to roll back transaction", e);
        }
    }

    @Override
    public void createSavepoint(String name) {
        Objects.requireNonNull(name, "name");
        try {
            Map<String, Savepoint> open = savepoints.get();
            if (open.containsKey(name)) {
                throw new IllegalArgumentException("Savepoint already exists: " + name);
            }
            open.put(name, connection().setSavepoint(name));
        } catch (SQLException e) {
            throw new TransactionBackendException("Failed to create savepoint " + name, e);
        }
    }

    @Override
    public void releaseSavepoint(String name) {
        Savepoint savepoint = savepoint(name);
        try {
            connection().releaseSavepoint(savepoint);
            savepoints.get().remove(name);
        } catch (SQLException e) {
            throw new TransactionBackendException("Failed to release savepoint " + name, e);
        }
    }

    @Override
    public void rollbackToSavepoint(String name) {
        Savepoint savepoint = savepoint(name);
        try {
            connection().rollback(savepoint);
            savepoints.get().remove(name);
        } catch (SQLException e) {
            throw new TransactionBackendException("Failed to roll back to savepoint " + name, e);
        }
    }

    @Override
    public boolean isTransactionOpen() {
        if (!connectionProvider.hasConnection()) {
            return false;
        }
        try {
            return !connection().getAutoCommit();
        } catch (SQLException e) {
            throw new TransactionBackendException("Failed to read auto-commit mode", e);
        }
    }

    private Connection connection() throws SQLException {
        return connectionProvider.getConnection();
    }

    private Savepoint savepoint(String name) {
        Savepoint savepoint = savepoints.get().get(Objects.requireNonNull(name, "name"));
        if (savepoint == null) {
            throw new IllegalArgumentException("No savepoint named " + name);
        }
        return savepoint;
    }
}
