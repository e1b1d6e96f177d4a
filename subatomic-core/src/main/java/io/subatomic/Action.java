package io.subatomic;

/**
 * Result-less unit of work run inside a scope by {@link ScopeOperation#run(Action)}.
 *
 * @param <E> checked exception the action may throw
 */
@FunctionalInterface
public interface Action<E extends Exception> {
    void execute() throws E;
}
