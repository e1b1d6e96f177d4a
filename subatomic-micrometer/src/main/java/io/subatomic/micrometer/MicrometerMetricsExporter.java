package io.subatomic.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.subatomic.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code subatomic.transactions.committed} — outermost scopes committed, real or simulated</li>
 *   <li>{@code subatomic.transactions.rolledback} — outermost scopes rolled back</li>
 *   <li>{@code subatomic.savepoints.released} — savepoints released</li>
 *   <li>{@code subatomic.savepoints.rolledback} — savepoints rolled back</li>
 *   <li>{@code subatomic.callbacks.run} — after-commit callbacks completed</li>
 *   <li>{@code subatomic.callbacks.failed} — after-commit callbacks that threw</li>
 *   <li>{@code subatomic.callbacks.unhandled} — leftover callbacks found by a new outermost scope</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter transactionsCommitted;
    private final Counter transactionsRolledBack;
    private final Counter savepointsReleased;
    private final Counter savepointsRolledBack;
    private final Counter callbacksRun;
    private final Counter callbacksFailed;
    private final Counter callbacksUnhandled;
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "subatomic"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "subatomic");
    }

    /**
     * Creates an exporter with a custom metric name prefix.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.db"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.transactionsCommitted = Counter.builder(namePrefix + ".transactions.committed")
                .description("Outermost transactions committed")
                .register(registry);
        this.transactionsRolledBack = Counter.builder(namePrefix + ".transactions.rolledback")
                .description("Outermost transactions rolled back")
                .register(registry);
        this.savepointsReleased = Counter.builder(namePrefix + ".savepoints.released")
                .description("Savepoints released")
                .register(registry);
        this.savepointsRolledBack = Counter.builder(namePrefix + ".savepoints.rolledback")
                .description("Savepoints rolled back")
                .register(registry);
        this.callbacksRun = Counter.builder(namePrefix + ".callbacks.run")
                .description("After-commit callbacks completed")
                .register(registry);
        this.callbacksFailed = Counter.builder(namePrefix + ".callbacks.failed")
                .description("After-commit callbacks that threw")
                .register(registry);
        this.callbacksUnhandled = Counter.builder(namePrefix + ".callbacks.unhandled")
                .description("Leftover after-commit callbacks found when a new transaction opened")
                .register(registry);
    }

    @Override
    public void incrementTransactionsCommitted() {
        if (closed) return;
        transactionsCommitted.increment();
    }

    @Override
    public void incrementTransactionsRolledBack() {
        if (closed) return;
        transactionsRolledBack.increment();
    }

    @Override
    public void incrementSavepointsReleased() {
        if (closed) return;
        savepointsReleased.increment();
    }

    @Override
    public void incrementSavepointsRolledBack() {
        if (closed) return;
        savepointsRolledBack.increment();
    }

    @Override
    public void incrementCallbacksRun() {
        if (closed) return;
        callbacksRun.increment();
    }

    @Override
    public void incrementCallbacksFailed() {
        if (closed) return;
        callbacksFailed.increment();
    }

    @Override
    public void recordUnhandledCallbacks(int count) {
        if (closed) return;
        callbacksUnhandled.increment(count);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(transactionsCommitted, transactionsRolledBack,
                savepointsReleased, savepointsRolledBack,
                callbacksRun, callbacksFailed, callbacksUnhandled)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
