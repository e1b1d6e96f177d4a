package io.subatomic;

/**
 * Scope stack and callback queue of one connection on one thread.
 */
final class ConnectionState {
    private static final long NO_HARNESS = 0L;

    private final String alias;
    private final ScopeStack stack = new ScopeStack();
    private final AfterCommitRegistry registry = new AfterCommitRegistry();
    private long harnessScopeId = NO_HARNESS;

    ConnectionState(String alias) {
        this.alias = alias;
    }

    String alias() {
        return alias;
    }

    ScopeStack stack() {
        return stack;
    }

    AfterCommitRegistry registry() {
        return registry;
    }

    /**
     * Returns {@code true} while a never-committing testcase transaction wraps this connection.
     * Commits of scopes opened inside it are simulated.
     */
    boolean hasHarness() {
        return harnessScopeId != NO_HARNESS;
    }

    long harnessScopeId() {
        return harnessScopeId;
    }

    void openHarness(long scopeId) {
        this.harnessScopeId = scopeId;
    }

    void reset() {
        stack.clear();
        registry.clear();
        harnessScopeId = NO_HARNESS;
    }
}
