package io.subatomic;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A scope policy bound to one connection, usable as a block or as a wrapper.
 *
 * <p>{@link #open()} is the only primitive. {@link #call(Work)} and {@link #run(Action)} wrap a
 * unit of work in {@code open()} / {@code complete()} / {@code close()}, so both shapes share
 * the same exit paths. The policy is evaluated on every {@code open()}, not when the operation
 * is created, so one instance can be kept and reused.
 */
public final class ScopeOperation {
    private final Supplier<Scope> opener;

    ScopeOperation(Supplier<Scope> opener) {
        this.opener = Objects.requireNonNull(opener, "opener");
    }

    /**
     * Checks the precondition and enters the scope.
     *
     * @return the open scope; use with try-with-resources
     */
    public Scope open() {
        return opener.get();
    }

    /**
     * Runs {@code work} inside the scope and returns its result.
     *
     * <p>If the work throws, the scope takes its exceptional exit and the exception propagates
     * unchanged; failures during the exit are attached to it as suppressed.
     */
    public <T, E extends Exception> T call(Work<T, E> work) throws E {
        Objects.requireNonNull(work, "work");
        try (Scope scope = open()) {
            T result = work.execute();
            scope.complete();
            return result;
        }
    }

    /**
     * Runs {@code action} inside the scope.
     *
     * @see #call(Work)
     */
    public <E extends Exception> void run(Action<E> action) throws E {
        Objects.requireNonNull(action, "action");
        this.<Void, E>call(() -> {
            action.execute();
            return null;
        });
    }
}
