package io.subatomic;

import io.subatomic.spi.BackendRegistry;
import io.subatomic.spi.MetricsExporter;
import io.subatomic.spi.TransactionBackend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for explicit transaction and savepoint scopes.
 *
 * <p>Each operation has exactly one precondition and one effect:
 * <ul>
 *   <li>{@link #transaction(String)} — opens a transaction; fails if one is already open</li>
 *   <li>{@link #transactionRequired(String)} — asserts a transaction is open; issues no SQL</li>
 *   <li>{@link #transactionIfNotAlready(String)} — either of the above, chosen at entry</li>
 *   <li>{@link #savepoint(String)} — opens a savepoint; fails outside a transaction</li>
 *   <li>{@link #durable(Runnable...)} — runs work that must not be part of any transaction</li>
 * </ul>
 *
 * <p>Connections are named by alias. Operations called without one use the builder's default
 * alias, {@value #DEFAULT_ALIAS} unless set. Scope stacks and callback queues are kept per thread.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Subatomic subatomic = Subatomic.builder()
 *     .backends(JdbcBackendRegistry.builder().dataSource("default", dataSource).build())
 *     .build();
 *
 * subatomic.transaction().run(() -> {
 *     orders.insert(order);
 *     subatomic.runAfterCommit(() -> mailer.sendConfirmation(order));
 * });
 * }</pre>
 *
 * @see ScopeOperation
 * @see SubatomicSettings
 */
public final class Subatomic {
    public static final String DEFAULT_ALIAS = "default";

    private static final Logger logger = Logger.getLogger(Subatomic.class.getName());

    private static final Scope PASS_THROUGH = new Scope() {
        @Override
        public void complete() {
        }

        @Override
        public void close() {
        }
    };

    private final BackendRegistry backends;
    private final String defaultAlias;
    private final Supplier<SubatomicSettings> settings;
    private final MetricsExporter metrics;
    private final ConnectionStates states = new ConnectionStates();
    private final CallbackSimulator simulator;

    private Subatomic(Builder builder) {
        this.backends = Objects.requireNonNull(builder.backends, "backends");
        this.defaultAlias = builder.defaultAlias;
        this.settings = builder.settings;
        this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
        this.simulator = new CallbackSimulator(metrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Scope operations ─────────────────────────────────────────────

    public ScopeOperation transaction() {
        return transaction(defaultAlias);
    }

    /**
     * Opens a new transaction on exit of which the work is committed, or rolled back if the
     * work fails. After-commit callbacks run right after the commit.
     *
     * <p>Never nests: entering it while a transaction is open throws
     * {@link TransactionAlreadyOpenException} rather than silently creating a savepoint.
     *
     * @param alias connection alias
     */
    public ScopeOperation transaction(String alias) {
        Objects.requireNonNull(alias, "alias");
        return new ScopeOperation(() -> openTransaction(alias));
    }

    public ScopeOperation transactionRequired() {
        return transactionRequired(defaultAlias);
    }

    /**
     * Asserts that a transaction is open. Pushes no frame and issues no SQL.
     *
     * @param alias connection alias
     * @throws MissingRequiredTransactionException on entry, if no transaction is open
     */
    public ScopeOperation transactionRequired(String alias) {
        Objects.requireNonNull(alias, "alias");
        return new ScopeOperation(() -> {
            if (!inTransaction(alias)) {
                throw new MissingRequiredTransactionException(alias);
            }
            return PASS_THROUGH;
        });
    }

    public ScopeOperation transactionIfNotAlready() {
        return transactionIfNotAlready(defaultAlias);
    }

    /**
     * Behaves as {@link #transactionRequired(String)} when a transaction is already open and as
     * {@link #transaction(String)} otherwise.
     *
     * <p>Prefer one of those two; this operation exists for code that genuinely cannot know.
     *
     * @param alias connection alias
     */
    public ScopeOperation transactionIfNotAlready(String alias) {
        Objects.requireNonNull(alias, "alias");
        return new ScopeOperation(() -> inTransaction(alias) ? PASS_THROUGH : openTransaction(alias));
    }

    public ScopeOperation savepoint() {
        return savepoint(defaultAlias);
    }

    /**
     * Opens a savepoint. Released on normal exit; on exceptional exit the transaction stays
     * open, rolled back to the state it had when the savepoint was created.
     *
     * @param alias connection alias
     * @throws MissingRequiredTransactionException on entry, if no transaction is open
     */
    public ScopeOperation savepoint(String alias) {
        Objects.requireNonNull(alias, "alias");
        return new ScopeOperation(() -> {
            TransactionBackend backend = backends.backend(alias);
            ConnectionState state = states.get(alias);
            if (!state.stack().isOpen()) {
                throw new MissingRequiredTransactionException(alias);
            }
            return new SavepointScope(state, backend);
        });
    }

    /**
     * Runs work that must not be part of any transaction, on any registered connection.
     *
     * <p>On exit, whether or not the work failed, the {@code cleanupActions} run once each in
     * order, then any transaction the work left open outside a scope is rolled back and
     * reported with {@link DanglingTransactionException}. When the work failed its exception
     * stays the one the caller sees.
     *
     * @param cleanupActions actions to run on every exit path
     * @throws TransactionAlreadyOpenException on entry, if any connection has a transaction open,
     *                                         including one begun outside any scope
     */
    public ScopeOperation durable(Runnable... cleanupActions) {
        List<Runnable> cleanup = List.of(cleanupActions);
        return new ScopeOperation(() -> {
            Set<String> open = new LinkedHashSet<>();
            for (String alias : backends.aliases()) {
                if (hasOpenTransaction(alias)) {
                    open.add(alias);
                }
            }
            if (!open.isEmpty()) {
                throw new TransactionAlreadyOpenException(open);
            }
            return new DurableScope(cleanup);
        });
    }

    /**
     * Test helper: treats the enclosed code as part of an application transaction that the
     * test itself stands in for.
     *
     * <p>Requires an open {@link TestcaseTransaction}. Callbacks registered inside are not run
     * on exit; they stay queued as a host transaction would leave them, and are reported by
     * the next outermost scope or {@link TestcaseTransaction#checkNoPendingCallbacks()}.
     *
     * @param alias connection alias
     */
    public ScopeOperation partOfATransaction(String alias) {
        Objects.requireNonNull(alias, "alias");
        return new ScopeOperation(() -> {
            TransactionBackend backend = backends.backend(alias);
            ConnectionState state = states.get(alias);
            if (!state.hasHarness()) {
                throw new IllegalStateException(
                        "partOfATransaction needs an open testcase transaction on '" + alias + "'");
            }
            if (state.stack().isOpen()) {
                throw new TransactionAlreadyOpenException(Set.of(alias));
            }
            return new RootScope(state, backend, false);
        });
    }

    public ScopeOperation partOfATransaction() {
        return partOfATransaction(defaultAlias);
    }

    // ── After-commit callbacks ───────────────────────────────────────

    public void runAfterCommit(Runnable callback) {
        runAfterCommit(defaultAlias, callback);
    }

    /**
     * Registers {@code callback} to run after the outermost transaction on {@code alias}
     * commits. Callbacks registered inside a savepoint still belong to the transaction.
     *
     * <p>With no transaction open this throws {@link NoTransactionOpenException}, unless
     * {@link SubatomicSettings#afterCommitNeedsTransaction()} is off, in which case the
     * callback runs immediately.
     *
     * @param alias    connection alias
     * @param callback action to run after commit
     */
    public void runAfterCommit(String alias, Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        backends.backend(alias);
        ConnectionState state = states.get(alias);
        ScopeFrame root = state.stack().outermostRoot();
        if (root != null) {
            state.registry().register(callback, root.scopeId());
            return;
        }
        SubatomicSettings current = currentSettings();
        if (current.afterCommitNeedsTransaction()) {
            throw new NoTransactionOpenException(alias);
        }
        if (state.hasHarness() && !current.runAfterCommitCallbacksInTests()) {
            state.registry().register(callback, state.harnessScopeId());
            return;
        }
        logger.log(Level.FINE, "No transaction open on ''{0}'', running after-commit callback now", alias);
        callback.run();
    }

    // ── State queries ────────────────────────────────────────────────

    public boolean inTransaction() {
        return inTransaction(defaultAlias);
    }

    /**
     * Returns {@code true} if a transaction scope is open on {@code alias}. A testcase
     * transaction on its own does not count, and neither does a transaction begun on the
     * connection outside any scope.
     */
    public boolean inTransaction(String alias) {
        backends.backend(alias);
        return states.get(alias).stack().isOpen();
    }

    /**
     * Returns the aliases that currently have an open transaction scope, in registration order.
     */
    public Set<String> aliasesWithOpenTransactions() {
        Set<String> open = new LinkedHashSet<>();
        for (String alias : backends.aliases()) {
            if (inTransaction(alias)) {
                open.add(alias);
            }
        }
        return Collections.unmodifiableSet(open);
    }

    // ── Test harness ─────────────────────────────────────────────────

    /**
     * Opens a never-committing transaction per alias that wraps a whole test.
     *
     * <p>Scopes opened inside it use savepoints at the SQL level and simulate their commits.
     * Close it to roll everything back.
     *
     * @param aliases connection aliases; the default alias if none are given
     */
    public TestcaseTransaction beginTestcaseTransaction(String... aliases) {
        List<String> selected = aliases.length == 0 ? List.of(defaultAlias) : Arrays.asList(aliases);
        return new TestcaseTransaction(this, selected);
    }

    ConnectionState state(String alias) {
        return states.get(alias);
    }

    TransactionBackend backend(String alias) {
        return backends.backend(alias);
    }

    SubatomicSettings currentSettings() {
        return Objects.requireNonNull(settings.get(), "settings");
    }

    /**
     * Like {@link #inTransaction(String)}, but also counts a transaction begun on the
     * connection outside any scope.
     */
    boolean hasOpenTransaction(String alias) {
        ConnectionState state = states.get(alias);
        return state.stack().isOpen() || (!state.hasHarness() && backends.backend(alias).isTransactionOpen());
    }

    private Scope openTransaction(String alias) {
        TransactionBackend backend = backends.backend(alias);
        ConnectionState state = states.get(alias);
        if (hasOpenTransaction(alias)) {
            throw new TransactionAlreadyOpenException(Set.of(alias));
        }
        simulator.checkLeftovers(state, currentSettings());
        return new RootScope(state, backend, true);
    }

    private static String savepointName(long scopeId) {
        return "subatomic_sp_" + scopeId;
    }

    // ── Scopes ───────────────────────────────────────────────────────

    /**
     * A scope backed by a frame on the connection's stack. Frames are popped on every exit
     * path, after the SQL for that exit has been issued.
     */
    private abstract class FrameScope implements Scope {
        final ConnectionState state;
        final TransactionBackend backend;
        ScopeFrame frame;
        private boolean completed;
        private boolean closed;

        FrameScope(ConnectionState state, TransactionBackend backend) {
            this.state = state;
            this.backend = backend;
        }

        @Override
        public void complete() {
            completed = true;
        }

        /**
         * Exits the scope. Closing it while an inner scope is still open rolls the inner scopes
         * back, takes the exceptional exit and then throws {@link IllegalStateException}.
         */
        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (!state.stack().contains(frame)) {
                // Unwound when an enclosing scope was closed first.
                return;
            }
            if (state.stack().peek() != frame) {
                IllegalStateException misuse = new IllegalStateException(
                        "Scope on '" + state.alias() + "' closed while an inner scope is still open");
                unwindInnerScopes(misuse);
                try {
                    exit(false);
                } catch (RuntimeException e) {
                    misuse.addSuppressed(e);
                }
                throw misuse;
            }
            exit(completed);
        }

        private void unwindInnerScopes(IllegalStateException misuse) {
            while (state.stack().peek() != frame) {
                ScopeFrame inner = state.stack().pop();
                logger.log(Level.WARNING, "Rolling back scope left open on ''{0}'' at depth {1}",
                        new Object[]{state.alias(), inner.depth()});
                try {
                    backend.rollbackToSavepoint(inner.savepointName());
                    metrics.incrementSavepointsRolledBack();
                } catch (RuntimeException e) {
                    misuse.addSuppressed(e);
                }
            }
        }

        private void exit(boolean normally) {
            boolean committed = false;
            try {
                if (normally) {
                    exitNormally();
                    committed = true;
                } else {
                    exitExceptionally();
                }
            } finally {
                state.stack().pop();
                if (!committed) {
                    afterRollback();
                }
            }
            afterCommit();
        }

        abstract void exitNormally();

        abstract void exitExceptionally();

        void afterRollback() {
        }

        void afterCommit() {
        }
    }

    private final class RootScope extends FrameScope {
        private final boolean simulated;
        private final boolean runsCallbacks;

        RootScope(ConnectionState state, TransactionBackend backend, boolean runsCallbacks) {
            super(state, backend);
            this.simulated = state.hasHarness();
            this.runsCallbacks = runsCallbacks;
            long scopeId = ScopeStack.nextScopeId();
            String name = simulated ? savepointName(scopeId) : null;
            if (simulated) {
                backend.createSavepoint(name);
            } else {
                backend.begin();
            }
            this.frame = state.stack().push(ScopeKind.ROOT, scopeId, name);
            logger.log(Level.FINE, "Opened transaction on ''{0}'' (simulated={1})",
                    new Object[]{state.alias(), simulated});
        }

        @Override
        void exitNormally() {
            try {
                if (simulated) {
                    backend.releaseSavepoint(frame.savepointName());
                } else {
                    backend.commit();
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Commit failed on ''{0}'', rolling back", state.alias());
                try {
                    exitExceptionally();
                } catch (RuntimeException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            }
            metrics.incrementTransactionsCommitted();
        }

        @Override
        void exitExceptionally() {
            if (simulated) {
                backend.rollbackToSavepoint(frame.savepointName());
            } else {
                backend.rollback();
            }
            metrics.incrementTransactionsRolledBack();
            logger.log(Level.FINE, "Rolled back transaction on ''{0}''", state.alias());
        }

        @Override
        void afterRollback() {
            simulator.afterRollback(state, frame.scopeId());
        }

        @Override
        void afterCommit() {
            if (runsCallbacks) {
                simulator.afterCommit(state, frame.scopeId(), simulated, currentSettings());
            }
        }
    }

    private final class SavepointScope extends FrameScope {

        SavepointScope(ConnectionState state, TransactionBackend backend) {
            super(state, backend);
            long scopeId = ScopeStack.nextScopeId();
            String name = savepointName(scopeId);
            backend.createSavepoint(name);
            this.frame = state.stack().push(ScopeKind.SAVEPOINT, scopeId, name);
        }

        @Override
        void exitNormally() {
            backend.releaseSavepoint(frame.savepointName());
            metrics.incrementSavepointsReleased();
        }

        @Override
        void exitExceptionally() {
            backend.rollbackToSavepoint(frame.savepointName());
            metrics.incrementSavepointsRolledBack();
        }
    }

    private final class DurableScope implements Scope {
        private final List<Runnable> cleanup;
        private boolean closed;

        DurableScope(List<Runnable> cleanup) {
            this.cleanup = cleanup;
        }

        @Override
        public void complete() {
            // Exit is the same either way.
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            List<RuntimeException> failures = new ArrayList<>();
            for (Runnable action : cleanup) {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    failures.add(e);
                }
            }
            Set<String> dangling = new LinkedHashSet<>();
            for (String alias : backends.aliases()) {
                ConnectionState state = states.get(alias);
                TransactionBackend backend = backends.backend(alias);
                if (state.hasHarness() || state.stack().isOpen() || !backend.isTransactionOpen()) {
                    continue;
                }
                dangling.add(alias);
                logger.log(Level.WARNING, "Rolling back transaction left open on ''{0}''", alias);
                try {
                    backend.rollback();
                } catch (RuntimeException e) {
                    failures.add(e);
                }
            }
            if (!dangling.isEmpty()) {
                failures.add(0, new DanglingTransactionException(dangling));
            }
            if (failures.isEmpty()) {
                return;
            }
            RuntimeException first = failures.get(0);
            for (RuntimeException other : failures.subList(1, failures.size())) {
                first.addSuppressed(other);
            }
            throw first;
        }
    }

    // ── Builder ──────────────────────────────────────────────────────

    public static final class Builder {
        private BackendRegistry backends;
        private String defaultAlias = DEFAULT_ALIAS;
        private Supplier<SubatomicSettings> settings = SubatomicSettings::defaults;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the connections to manage. Required.
         */
        public Builder backends(BackendRegistry backends) {
            this.backends = backends;
            return this;
        }

        /**
         * Sets the alias used by the operations that take none. Defaults to
         * {@value Subatomic#DEFAULT_ALIAS}.
         */
        public Builder defaultAlias(String defaultAlias) {
            this.defaultAlias = Objects.requireNonNull(defaultAlias, "defaultAlias");
            return this;
        }

        /**
         * Sets fixed settings. Defaults to {@link SubatomicSettings#defaults()}.
         */
        public Builder settings(SubatomicSettings settings) {
            Objects.requireNonNull(settings, "settings");
            this.settings = () -> settings;
            return this;
        }

        /**
         * Sets a settings source consulted on every operation.
         */
        public Builder settings(Supplier<SubatomicSettings> settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        /**
         * Sets the metrics exporter; {@code null} means {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Subatomic build() {
            return new Subatomic(this);
        }
    }
}
