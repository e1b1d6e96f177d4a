package io.subatomic;

/**
 * Thrown by {@link Subatomic#runAfterCommit} when no transaction is open on the connection
 * and {@link SubatomicSettings#afterCommitNeedsTransaction()} is on.
 */
public final class NoTransactionOpenException extends IllegalStateException {
    private final String alias;

    public NoTransactionOpenException(String alias) {
        super("Cannot register an after-commit callback: no transaction open on '" + alias + "'");
        this.alias = alias;
    }

    public String alias() {
        return alias;
    }
}
