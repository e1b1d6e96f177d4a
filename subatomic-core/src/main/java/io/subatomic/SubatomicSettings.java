package io.subatomic;

/**
 * Strictness toggles, resolved at the point of each operation.
 *
 * <p>Pass a fixed value or a {@code Supplier} to {@link Subatomic.Builder#settings}; the
 * supplier is consulted on every call, so changes take effect immediately.
 *
 * @param afterCommitNeedsTransaction               if {@code true} (default),
 *                                                  {@link Subatomic#runAfterCommit} outside a
 *                                                  transaction throws {@link NoTransactionOpenException};
 *                                                  if {@code false} the callback runs immediately
 * @param runAfterCommitCallbacksInTests            if {@code true} (default), callbacks run when a
 *                                                  scope's commit is simulated inside a testcase
 *                                                  transaction
 * @param catchUnhandledAfterCommitCallbacksInTests if {@code true} (default), leftover callbacks
 *                                                  found when an outermost scope opens raise
 *                                                  {@link UnhandledCallbacksException}; if
 *                                                  {@code false} they are run first
 */
public record SubatomicSettings(
        boolean afterCommitNeedsTransaction,
        boolean runAfterCommitCallbacksInTests,
        boolean catchUnhandledAfterCommitCallbacksInTests
) {
    private static final SubatomicSettings DEFAULTS = new SubatomicSettings(true, true, true);

    public static SubatomicSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .afterCommitNeedsTransaction(afterCommitNeedsTransaction)
                .runAfterCommitCallbacksInTests(runAfterCommitCallbacksInTests)
                .catchUnhandledAfterCommitCallbacksInTests(catchUnhandledAfterCommitCallbacksInTests);
    }

    public static final class Builder {
        private boolean afterCommitNeedsTransaction = true;
        private boolean runAfterCommitCallbacksInTests = true;
        private boolean catchUnhandledAfterCommitCallbacksInTests = true;

        private Builder() {
        }

        public Builder afterCommitNeedsTransaction(boolean afterCommitNeedsTransaction) {
            this.afterCommitNeedsTransaction = afterCommitNeedsTransaction;
            return this;
        }

        public Builder runAfterCommitCallbacksInTests(boolean runAfterCommitCallbacksInTests) {
            this.runAfterCommitCallbacksInTests = runAfterCommitCallbacksInTests;
            return this;
        }

        public Builder catchUnhandledAfterCommitCallbacksInTests(boolean catchUnhandledAfterCommitCallbacksInTests) {
            this.catchUnhandledAfterCommitCallbacksInTests = catchUnhandledAfterCommitCallbacksInTests;
            return this;
        }

        public SubatomicSettings build() {
            return new SubatomicSettings(
                    afterCommitNeedsTransaction,
                    runAfterCommitCallbacksInTests,
                    catchUnhandledAfterCommitCallbacksInTests);
        }
    }
}
