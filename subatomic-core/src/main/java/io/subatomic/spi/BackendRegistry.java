package io.subatomic.spi;

import java.util.Map;
import java.util.Set;

/**
 * Looks up the {@link TransactionBackend} of each named connection.
 *
 * @see io.subatomic.Subatomic
 */
public interface BackendRegistry {

    /**
     * Returns the backend for the given connection alias.
     *
     * @param alias connection alias
     * @return the backend, never {@code null}
     * @throws IllegalArgumentException if no connection is registered under {@code alias}
     */
    TransactionBackend backend(String alias);

    /**
     * Returns every registered alias, in registration order.
     */
    Set<String> aliases();

    /**
     * Creates a registry over a fixed alias-to-backend map.
     *
     * @param backends backends keyed by alias; copied
     * @return an immutable registry
     */
    static BackendRegistry of(Map<String, ? extends TransactionBackend> backends) {
        return new MapBackendRegistry(backends);
    }
}
