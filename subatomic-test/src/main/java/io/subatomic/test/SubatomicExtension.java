package io.subatomic.test;

import io.subatomic.Subatomic;
import io.subatomic.TestcaseTransaction;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.BeforeTestExecutionCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.util.Objects;

/**
 * JUnit 5 extension that wraps every test in a {@link TestcaseTransaction}.
 *
 * <p>The testcase transaction opens before any {@code @BeforeEach} method and is rolled back
 * after the test, so data written by set-up code and by the test never leaks into the next one.
 * Just before the test body runs, pending after-commit callbacks left by set-up code are
 * reported with {@link io.subatomic.UnhandledCallbacksException}.
 *
 * <pre>{@code
 * @RegisterExtension
 * static final SubatomicExtension transactions = new SubatomicExtension(subatomic);
 * }</pre>
 */
public final class SubatomicExtension
        implements BeforeEachCallback, BeforeTestExecutionCallback, AfterEachCallback {
    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(SubatomicExtension.class);
    private static final String TESTCASE_KEY = "testcase";

    private final Subatomic subatomic;
    private final String[] aliases;

    /**
     * @param subatomic the instance whose connections are wrapped
     * @param aliases   connection aliases to wrap; the instance's default alias if none are given
     */
    public SubatomicExtension(Subatomic subatomic, String... aliases) {
        this.subatomic = Objects.requireNonNull(subatomic, "subatomic");
        this.aliases = aliases.clone();
    }

    public Subatomic subatomic() {
        return subatomic;
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        store(context).put(TESTCASE_KEY, subatomic.beginTestcaseTransaction(aliases));
    }

    @Override
    public void beforeTestExecution(ExtensionContext context) {
        TestcaseTransaction testcase = store(context).get(TESTCASE_KEY, TestcaseTransaction.class);
        if (testcase != null) {
            testcase.checkNoPendingCallbacks();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        TestcaseTransaction testcase = store(context).remove(TESTCASE_KEY, TestcaseTransaction.class);
        if (testcase != null) {
            testcase.close();
        }
    }

    private static ExtensionContext.Store store(ExtensionContext context) {
        return context.getStore(NAMESPACE);
    }
}
