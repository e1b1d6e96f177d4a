package io.subatomic;

import java.util.List;

/**
 * Thrown in tests when after-commit callbacks left behind by an earlier scope are still
 * queued as a new outermost scope opens.
 *
 * <p>Reports a test-ordering bug: the callbacks would have run at a different point in
 * production. Not meant to be caught.
 *
 * @see SubatomicSettings#catchUnhandledAfterCommitCallbacksInTests()
 */
public final class UnhandledCallbacksException extends IllegalStateException {
    private final String alias;
    private final List<Runnable> callbacks;

    public UnhandledCallbacksException(String alias, List<Runnable> callbacks) {
        super(callbacks.size() + " after-commit callback(s) on '" + alias
                + "' were left unhandled by an earlier scope");
        this.alias = alias;
        this.callbacks = List.copyOf(callbacks);
    }

    public String alias() {
        return alias;
    }

    /**
     * Returns the leftover callbacks in registration order.
     */
    public List<Runnable> callbacks() {
        return callbacks;
    }
}
