package io.subatomic.spi;

/**
 * Observability hook for exporting scope and callback counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of outermost transactions committed (real or simulated).
     */
    void incrementTransactionsCommitted();

    /**
     * Increments the count of outermost transactions rolled back.
     */
    void incrementTransactionsRolledBack();

    /**
     * Increments the count of savepoints released.
     */
    void incrementSavepointsReleased();

    /**
     * Increments the count of savepoints rolled back.
     */
    void incrementSavepointsRolledBack();

    /**
     * Increments the count of after-commit callbacks that completed normally.
     */
    void incrementCallbacksRun();

    /**
     * Increments the count of after-commit callbacks that threw.
     */
    void incrementCallbacksFailed();

    /**
     * Records leftover callbacks found when a new outermost scope opened.
     *
     * @param count number of leftover callbacks
     */
    default void recordUnhandledCallbacks(int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementTransactionsCommitted() {
        }

        @Override
        public void incrementTransactionsRolledBack() {
        }

        @Override
        public void incrementSavepointsReleased() {
        }

        @Override
        public void incrementSavepointsRolledBack() {
        }

        @Override
        public void incrementCallbacksRun() {
        }

        @Override
        public void incrementCallbacksFailed() {
        }
    }
}
