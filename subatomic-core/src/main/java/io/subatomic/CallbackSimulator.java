package io.subatomic;

import io.subatomic.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs after-commit callbacks when an outermost scope exits and polices leftovers.
 *
 * <p>Outside a testcase transaction the commit is real and bound callbacks always run. Inside
 * one the commit is simulated, and callbacks run only when
 * {@link SubatomicSettings#runAfterCommitCallbacksInTests()} is on. Either way they run at the
 * same logical point and in the same order as they would after a production commit.
 */
final class CallbackSimulator {
    private static final Logger logger = Logger.getLogger(CallbackSimulator.class.getName());

    private final MetricsExporter metrics;

    CallbackSimulator(MetricsExporter metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Called as a new outermost scope opens, before any transaction work.
     *
     * @throws UnhandledCallbacksException if callbacks are queued and strict mode is on
     */
    void checkLeftovers(ConnectionState state, SubatomicSettings settings) {
        AfterCommitRegistry registry = state.registry();
        if (registry.isEmpty()) {
            return;
        }
        metrics.recordUnhandledCallbacks(registry.size());
        if (settings.catchUnhandledAfterCommitCallbacksInTests()) {
            throw new UnhandledCallbacksException(state.alias(), registry.pendingCallbacks());
        }
        logger.log(Level.WARNING, "Running {0} leftover after-commit callback(s) on ''{1}''",
                new Object[]{registry.size(), state.alias()});
        runAll(registry.takeAll());
    }

    /**
     * Called after the outermost scope bound to {@code scopeId} committed and was popped.
     */
    void afterCommit(ConnectionState state, long scopeId, boolean simulated, SubatomicSettings settings) {
        if (simulated && !settings.runAfterCommitCallbacksInTests()) {
            return;
        }
        runAll(state.registry().take(scopeId));
    }

    /**
     * Called after the outermost scope bound to {@code scopeId} rolled back.
     */
    void afterRollback(ConnectionState state, long scopeId) {
        int dropped = state.registry().discard(scopeId);
        if (dropped > 0) {
            logger.log(Level.FINE, "Discarded {0} after-commit callback(s) on ''{1}'' after rollback",
                    new Object[]{dropped, state.alias()});
        }
    }

    /**
     * Runs every callback once, in order. A failure does not stop later callbacks; the first
     * failure is rethrown afterwards with the others suppressed.
     */
    void runAll(List<CallbackEntry> entries) {
        RuntimeException first = null;
        for (CallbackEntry entry : entries) {
            try {
                entry.callback().run();
                metrics.incrementCallbacksRun();
            } catch (RuntimeException e) {
                metrics.incrementCallbacksFailed();
                logger.log(Level.WARNING, "After-commit callback failed", e);
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
