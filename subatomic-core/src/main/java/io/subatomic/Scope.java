package io.subatomic;

/**
 * An open scope returned by {@link ScopeOperation#open()}.
 *
 * <p>Call {@link #complete()} as the last statement of the block. {@link #close()} then takes
 * the normal exit (commit, release). A scope closed without {@code complete()}, because the
 * block threw or returned early, takes the exceptional exit (rollback):
 * <pre>{@code
 * try (Scope scope = subatomic.transaction().open()) {
 *     insertOrder(order);
 *     scope.complete();
 * }
 * }</pre>
 */
public interface Scope extends AutoCloseable {

    /**
     * Marks the wrapped work as finished normally.
     */
    void complete();

    /**
     * Exits the scope. Idempotent.
     */
    @Override
    void close();
}
