package io.subatomic.spring.boot;

import io.subatomic.Subatomic;
import io.subatomic.SubatomicSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Subatomic.
 *
 * @see SubatomicAutoConfiguration
 */
@ConfigurationProperties(prefix = "subatomic")
public class SubatomicProperties {

    /**
     * Whether registering an after-commit callback outside a transaction is an error.
     * When false the callback runs immediately.
     */
    private boolean afterCommitNeedsTransaction = true;

    /**
     * Whether after-commit callbacks run when a commit is simulated inside a testcase transaction.
     */
    private boolean runAfterCommitCallbacksInTests = true;

    /**
     * Whether leftover after-commit callbacks fail the next transaction in tests.
     * When false they are run first.
     */
    private boolean catchUnhandledAfterCommitCallbacksInTests = true;

    /**
     * Alias under which the application {@code DataSource} is registered.
     */
    private String defaultAlias = Subatomic.DEFAULT_ALIAS;

    private final Metrics metrics = new Metrics();

    public boolean isAfterCommitNeedsTransaction() {
        return afterCommitNeedsTransaction;
    }

    public void setAfterCommitNeedsTransaction(boolean afterCommitNeedsTransaction) {
        this.afterCommitNeedsTransaction = afterCommitNeedsTransaction;
    }

    public boolean isRunAfterCommitCallbacksInTests() {
        return runAfterCommitCallbacksInTests;
    }

    public void setRunAfterCommitCallbacksInTests(boolean runAfterCommitCallbacksInTests) {
        this.runAfterCommitCallbacksInTests = runAfterCommitCallbacksInTests;
    }

    public boolean isCatchUnhandledAfterCommitCallbacksInTests() {
        return catchUnhandledAfterCommitCallbacksInTests;
    }

    public void setCatchUnhandledAfterCommitCallbacksInTests(boolean catchUnhandledAfterCommitCallbacksInTests) {
        this.catchUnhandledAfterCommitCallbacksInTests = catchUnhandledAfterCommitCallbacksInTests;
    }

    public String getDefaultAlias() {
        return defaultAlias;
    }

    public void setDefaultAlias(String defaultAlias) {
        this.defaultAlias = defaultAlias;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Snapshot of the strictness toggles as they are now.
     */
    public SubatomicSettings toSettings() {
        return SubatomicSettings.builder()
                .afterCommitNeedsTransaction(afterCommitNeedsTransaction)
                .runAfterCommitCallbacksInTests(runAfterCommitCallbacksInTests)
                .catchUnhandledAfterCommitCallbacksInTests(catchUnhandledAfterCommitCallbacksInTests)
                .build();
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "subatomic";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
