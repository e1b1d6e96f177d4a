package io.subatomic;

import java.util.Set;

/**
 * Thrown when work run under {@link Subatomic#durable} leaves a transaction open outside any
 * scope. The dangling transactions have been rolled back by the time this is thrown.
 */
public final class DanglingTransactionException extends IllegalStateException {
    private final Set<String> aliases;

    public DanglingTransactionException(Set<String> aliases) {
        super("Durable work left a transaction open on " + aliases + "; rolled back");
        this.aliases = Set.copyOf(aliases);
    }

    public Set<String> aliases() {
        return aliases;
    }
}
