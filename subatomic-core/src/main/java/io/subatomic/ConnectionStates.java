package io.subatomic;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-thread {@link ConnectionState}s keyed by alias.
 *
 * <p>Each thread sees its own stacks and queues, so concurrent executions never share
 * transaction state.
 */
final class ConnectionStates {
    private final ThreadLocal<Map<String, ConnectionState>> states = ThreadLocal.withInitial(HashMap::new);

    ConnectionState get(String alias) {
        return states.get().computeIfAbsent(alias, ConnectionState::new);
    }
}
