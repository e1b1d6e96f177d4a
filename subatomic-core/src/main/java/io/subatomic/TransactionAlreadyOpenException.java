package io.subatomic;

import java.util.Set;

/**
 * Thrown when {@link Subatomic#transaction} or {@link Subatomic#durable} is entered while a
 * transaction is already open.
 *
 * <p>Never retried: the call graph has to be restructured so the scope is not nested.
 */
public final class TransactionAlreadyOpenException extends IllegalStateException {
    private final Set<String> aliases;

    public TransactionAlreadyOpenException(Set<String> aliases) {
        super("Transaction already open on " + aliases);
        this.aliases = Set.copyOf(aliases);
    }

    /**
     * Returns the aliases of the connections that had an open transaction.
     */
    public Set<String> aliases() {
        return aliases;
    }
}
