package io.subatomic.jdbc;

import io.subatomic.spi.BackendRegistry;
import io.subatomic.spi.TransactionBackend;

import javax.sql.DataSource;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link BackendRegistry} over one or more JDBC connections, each named by an alias.
 *
 * <pre>{@code
 * JdbcBackendRegistry backends = JdbcBackendRegistry.builder()
 *     .dataSource("default", primary)
 *     .dataSource("reporting", reporting)
 *     .build();
 * }</pre>
 */
public final class JdbcBackendRegistry implements BackendRegistry {
    private final Map<String, JdbcTransactionBackend> backends;

    private JdbcBackendRegistry(Map<String, JdbcTransactionBackend> backends) {
        this.backends = Collections.unmodifiableMap(new LinkedHashMap<>(backends));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TransactionBackend backend(String alias) {
        JdbcTransactionBackend backend = backends.get(alias);
        if (backend == null) {
            throw new IllegalArgumentException("No connection registered under alias '" + alias + "'");
        }
        return backend;
    }

    @Override
    public Set<String> aliases() {
        return backends.keySet();
    }

    /**
     * Returns the connection provider registered under {@code alias}.
     */
    public ConnectionProvider connectionProvider(String alias) {
        return ((JdbcTransactionBackend) backend(alias)).connectionProvider();
    }

    /**
     * Releases the calling thread's connection on every alias.
     */
    public void release() {
        RuntimeException first = null;
        for (JdbcTransactionBackend backend : backends.values()) {
            try {
                backend.connectionProvider().release();
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    public static final class Builder {
        private final Map<String, JdbcTransactionBackend> backends = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a {@link DataSource} under {@code alias}, with one connection per thread.
         */
        public Builder dataSource(String alias, DataSource dataSource) {
            return connectionProvider(alias, new ThreadBoundConnectionProvider(dataSource));
        }

        public Builder connectionProvider(String alias, ConnectionProvider connectionProvider) {
            Objects.requireNonNull(alias, "alias");
            if (backends.containsKey(alias)) {
                throw new IllegalArgumentException("Alias already registered: " + alias);
            }
            backends.put(alias, new JdbcTransactionBackend(connectionProvider));
            return this;
        }

        public JdbcBackendRegistry build() {
            if (backends.isEmpty()) {
                throw new IllegalStateException("At least one connection must be registered");
            }
            return new JdbcBackendRegistry(backends);
        }
    }
}
