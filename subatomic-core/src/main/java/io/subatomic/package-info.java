/**
 * Explicit transaction and savepoint scopes with after-commit callbacks.
 *
 * <h2>Core Design</h2>
 * <p>A host "atomic block" that opens a transaction, opens a savepoint or merely asserts one
 * is open depending on where it is called from is replaced by five single-purpose
 * operations on {@link io.subatomic.Subatomic}. Each consults a per-connection
 * {@link io.subatomic.ScopeStack}, so what an operation will do is decided by an explicit
 * query rather than by the call stack.
 *
 * <p>After-commit callbacks registered with
 * {@link io.subatomic.Subatomic#runAfterCommit(String, Runnable) runAfterCommit} bind to the
 * outermost transaction and run in registration order right after it commits. Under a
 * {@link io.subatomic.TestcaseTransaction} the commit is simulated and the callbacks still run
 * at the same point, so tests see the side effects production would.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>subatomic-core</b> — scopes, callback registry, test harness (zero external deps)</li>
 *   <li><b>subatomic-jdbc</b> — JDBC transaction backends</li>
 *   <li><b>subatomic-test</b> — JUnit 5 extension wrapping each test in a testcase transaction</li>
 *   <li><b>subatomic-micrometer</b> — optional Micrometer metrics bridge</li>
 *   <li><b>subatomic-spring-boot-starter</b> — Spring Boot auto-configuration</li>
 * </ul>
 *
 * @see io.subatomic.Subatomic
 * @see io.subatomic.ScopeOperation
 * @see io.subatomic.SubatomicSettings
 */
package io.subatomic;
