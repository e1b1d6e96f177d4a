package io.subatomic;

import io.subatomic.spi.TransactionBackend;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A never-committing transaction wrapping a whole test, one per alias.
 *
 * <p>While it is open, {@link Subatomic#inTransaction(String)} ignores it, scopes use
 * savepoints at the SQL level and their commits are simulated. {@link #close()} rolls
 * everything back and forgets any state the test left behind.
 *
 * <pre>{@code
 * try (TestcaseTransaction testcase = subatomic.beginTestcaseTransaction()) {
 *     testcase.checkNoPendingCallbacks();
 *     // test body
 * }
 * }</pre>
 *
 * @see Subatomic#beginTestcaseTransaction(String...)
 */
public final class TestcaseTransaction implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(TestcaseTransaction.class.getName());

    private final Subatomic subatomic;
    private final List<String> aliases;
    private boolean closed;

    TestcaseTransaction(Subatomic subatomic, List<String> aliases) {
        this.subatomic = subatomic;
        this.aliases = List.copyOf(aliases);
        List<String> opened = new ArrayList<>();
        try {
            for (String alias : this.aliases) {
                ConnectionState state = subatomic.state(alias);
                if (state.hasHarness()) {
                    throw new IllegalStateException("Testcase transaction already open on '" + alias + "'");
                }
                if (subatomic.hasOpenTransaction(alias)) {
                    throw new TransactionAlreadyOpenException(Set.of(alias));
                }
                subatomic.backend(alias).begin();
                state.openHarness(ScopeStack.nextScopeId());
                opened.add(alias);
            }
        } catch (RuntimeException e) {
            RuntimeException rollbackFailure = rollBack(opened);
            if (rollbackFailure != null) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Start-of-test hook: fails if after-commit callbacks are already queued on the wrapping
     * transaction, for example by set-up code run inside
     * {@link Subatomic#partOfATransaction(String)}.
     *
     * <p>Does nothing when {@link SubatomicSettings#catchUnhandledAfterCommitCallbacksInTests()}
     * is off.
     *
     * @throws UnhandledCallbacksException if callbacks are pending
     */
    public void checkNoPendingCallbacks() {
        if (!subatomic.currentSettings().catchUnhandledAfterCommitCallbacksInTests()) {
            return;
        }
        for (String alias : aliases) {
            AfterCommitRegistry registry = subatomic.state(alias).registry();
            if (!registry.isEmpty()) {
                throw new UnhandledCallbacksException(alias, registry.pendingCallbacks());
            }
        }
    }

    /**
     * Rolls back every wrapped connection. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        RuntimeException failure = rollBack(aliases);
        if (failure != null) {
            throw failure;
        }
    }

    private RuntimeException rollBack(List<String> targets) {
        RuntimeException first = null;
        for (int i = targets.size() - 1; i >= 0; i--) {
            String alias = targets.get(i);
            ConnectionState state = subatomic.state(alias);
            if (state.stack().isOpen()) {
                logger.log(Level.WARNING, "Test left {0} scope(s) open on ''{1}''",
                        new Object[]{state.stack().depth(), alias});
            }
            state.reset();
            TransactionBackend backend = subatomic.backend(alias);
            try {
                backend.rollback();
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        return first;
    }
}
