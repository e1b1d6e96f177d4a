package io.subatomic;

/**
 * Thrown by {@link Subatomic#transactionRequired} and {@link Subatomic#savepoint} when no
 * transaction is open on the connection.
 *
 * <p>Signals a missing higher-level {@code transaction} scope.
 */
public final class MissingRequiredTransactionException extends IllegalStateException {
    private final String alias;

    public MissingRequiredTransactionException(String alias) {
        super("A transaction is required but none is open on '" + alias + "'");
        this.alias = alias;
    }

    public String alias() {
        return alias;
    }
}
