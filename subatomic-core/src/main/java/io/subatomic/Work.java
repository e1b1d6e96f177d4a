package io.subatomic;

/**
 * Unit of work run inside a scope by {@link ScopeOperation#call(Work)}.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 */
@FunctionalInterface
public interface Work<T, E extends Exception> {
    T execute() throws E;
}
