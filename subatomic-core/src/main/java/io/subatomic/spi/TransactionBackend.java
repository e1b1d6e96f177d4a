package io.subatomic.spi;

/**
 * SQL-level transaction control for one named connection.
 *
 * <p>Scope operations decide <em>which</em> of these calls to make; implementations only
 * issue them. Implementations report failures as unchecked exceptions.
 *
 * <p>Implementations: {@code io.subatomic.jdbc.JdbcTransactionBackend}.
 *
 * @see BackendRegistry
 */
public interface TransactionBackend {

    /**
     * Starts a real database transaction.
     */
    void begin();

    /**
     * Commits the real database transaction started by {@link #begin()}.
     */
    void commit();

    /**
     * Rolls back the real database transaction started by {@link #begin()}.
     */
    void rollback();

    /**
     * Creates a savepoint inside the open transaction.
     *
     * @param name savepoint name, a plain SQL identifier
     */
    void createSavepoint(String name);

    /**
     * Releases a savepoint, keeping the work done since it was created.
     *
     * @param name savepoint name passed to {@link #createSavepoint(String)}
     */
    void releaseSavepoint(String name);

    /**
     * Discards all work done since the savepoint was created.
     *
     * @param name savepoint name passed to {@link #createSavepoint(String)}
     */
    void rollbackToSavepoint(String name);

    /**
     * Returns {@code true} if the underlying connection currently has an open transaction.
     *
     * <p>Used as a consistency cross-check against the scope stack. Must not open a
     * physical connection just to answer.
     */
    boolean isTransactionOpen();
}
