package io.subatomic;

import io.subatomic.spi.BackendRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AfterCommitTest {
    private RecordingBackend backend;
    private RecordingBackend other;
    private List<String> events;

    @BeforeEach
    void setUp() {
        backend = new RecordingBackend();
        other = new RecordingBackend();
        events = new ArrayList<>();
    }

    private Subatomic subatomic(SubatomicSettings settings) {
        return Subatomic.builder()
                .backends(BackendRegistry.of(Map.of("default", backend, "other", other)))
                .settings(settings)
                .build();
    }

    @Test
    void callbacksRunInRegistrationOrderAfterCommit() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        subatomic.transaction().run(() -> {
            subatomic.runAfterCommit(() -> events.add("first"));
            subatomic.runAfterCommit(() -> events.add("second"));
            assertTrue(events.isEmpty());
        });

        assertEquals(List.of("first", "second"), events);
    }

    @Test
    void callbacksRunAfterTheCommitIsIssued() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        subatomic.transaction().run(() ->
                subatomic.runAfterCommit(() -> events.addAll(backend.operations)));

        assertEquals(List.of("BEGIN", "COMMIT"), events);
    }

    @Test
    void callbacksRunExactlyOnce() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        subatomic.transaction().run(() -> subatomic.runAfterCommit(() -> events.add("once")));
        subatomic.transaction().run(() -> {
        });

        assertEquals(List.of("once"), events);
    }

    @Test
    void callbacksAreDiscardedOnRollback() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        assertThrows(IllegalStateException.class, () ->
                subatomic.transaction().run(() -> {
                    subatomic.runAfterCommit(() -> events.add("never"));
                    throw new IllegalStateException();
                }));
        subatomic.transaction().run(() -> {
        });

        assertTrue(events.isEmpty());
    }

    @Test
    void callbackRegisteredInSavepointRunsAfterOutermostCommit() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        subatomic.transaction().run(() -> {
            subatomic.savepoint().run(() -> subatomic.runAfterCommit(() -> events.add("savepoint")));
            assertTrue(events.isEmpty());
        });

        assertEquals(List.of("savepoint"), events);
    }

    @Test
    void callbackRegisteredInRolledBackSavepointStillRuns() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        subatomic.transaction().run(() ->
                assertThrows(IllegalStateException.class, () ->
                        subatomic.savepoint().run(() -> {
                            subatomic.runAfterCommit(() -> events.add("kept"));
                            throw new IllegalStateException();
                        })));

        assertEquals(List.of("kept"), events);
    }

    @Test
    void failingCallbackDoesNotStopLaterCallbacks() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());
        IllegalStateException firstFailure = new IllegalStateException("first");
        IllegalStateException secondFailure = new IllegalStateException("second");

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
                subatomic.transaction().run(() -> {
                    subatomic.runAfterCommit(() -> {
                        throw firstFailure;
                    });
                    subatomic.runAfterCommit(() -> events.add("after"));
                    subatomic.runAfterCommit(() -> {
                        throw secondFailure;
                    });
                }));

        assertSame(firstFailure, thrown);
        assertEquals(1, thrown.getSuppressed().length);
        assertSame(secondFailure, thrown.getSuppressed()[0]);
        assertEquals(List.of("after"), events);
        // The transaction itself stays committed.
        assertEquals(List.of("BEGIN", "COMMIT"), backend.operations);
    }

    @Test
    void callbackMayOpenANewTransaction() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        subatomic.transaction().run(() ->
                subatomic.runAfterCommit(() ->
                        subatomic.transaction().run(() -> events.add("nested commit"))));

        assertEquals(List.of("nested commit"), events);
        assertEquals(List.of("BEGIN", "COMMIT", "BEGIN", "COMMIT"), backend.operations);
    }

    @Test
    void callbacksAreBoundToTheirOwnAlias() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        subatomic.transaction("default").run(() -> {
            subatomic.transaction("other").run(() ->
                    subatomic.runAfterCommit("default", () -> events.add("default")));
            assertTrue(events.isEmpty());
        });

        assertEquals(List.of("default"), events);
    }

    @Test
    void registeringOutsideTransactionFailsByDefault() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        NoTransactionOpenException ex = assertThrows(NoTransactionOpenException.class,
                () -> subatomic.runAfterCommit(() -> events.add("never")));

        assertEquals("default", ex.alias());
        assertTrue(events.isEmpty());
    }

    @Test
    void registeringOutsideTransactionRunsImmediatelyInLegacyMode() {
        Subatomic subatomic = subatomic(SubatomicSettings.builder()
                .afterCommitNeedsTransaction(false)
                .build());

        subatomic.runAfterCommit(() -> events.add("now"));

        assertEquals(List.of("now"), events);
    }

    @Test
    void settingsSupplierIsReadOnEveryCall() {
        AtomicReference<SubatomicSettings> current = new AtomicReference<>(SubatomicSettings.defaults());
        Subatomic subatomic = Subatomic.builder()
                .backends(BackendRegistry.of(Map.of("default", backend)))
                .settings(current::get)
                .build();

        assertThrows(NoTransactionOpenException.class, () -> subatomic.runAfterCommit(() -> events.add("x")));

        current.set(current.get().toBuilder().afterCommitNeedsTransaction(false).build());
        subatomic.runAfterCommit(() -> events.add("y"));

        assertEquals(List.of("y"), events);
    }

    @Test
    void callbackInsideTransactionRequiredIsBoundToEnclosingTransaction() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        subatomic.transaction().run(() ->
                subatomic.transactionRequired().run(() ->
                        subatomic.runAfterCommit(() -> events.add("bound"))));

        assertEquals(List.of("bound"), events);
    }

    @Test
    void callbackRunsBetweenTransactionBodyAndCodeAfterIt() {
        Subatomic subatomic = subatomic(SubatomicSettings.defaults());

        subatomic.transaction().run(() -> {
            events.add("A");
            subatomic.runAfterCommit(() -> events.add("C"));
            events.add("B");
        });
        events.add("D");

        assertEquals(List.of("A", "B", "C", "D"), events);
    }
}
