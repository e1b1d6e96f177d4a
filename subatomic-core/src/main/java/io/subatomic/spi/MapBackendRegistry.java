package io.subatomic.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

final class MapBackendRegistry implements BackendRegistry {
    private final Map<String, TransactionBackend> backends;

    MapBackendRegistry(Map<String, ? extends TransactionBackend> backends) {
        Objects.requireNonNull(backends, "backends");
        Map<String, TransactionBackend> copy = new LinkedHashMap<>();
        backends.forEach((alias, backend) -> copy.put(
                Objects.requireNonNull(alias, "alias"),
                Objects.requireNonNull(backend, "backend")));
        this.backends = Collections.unmodifiableMap(copy);
    }

    @Override
    public TransactionBackend backend(String alias) {
        TransactionBackend backend = backends.get(alias);
        if (backend == null) {
            throw new IllegalArgumentException("No connection registered under alias '" + alias + "'");
        }
        return backend;
    }

    @Override
    public Set<String> aliases() {
        return backends.keySet();
    }
}
