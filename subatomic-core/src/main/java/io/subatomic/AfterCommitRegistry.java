package io.subatomic;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * FIFO queue of after-commit callbacks for one connection.
 */
final class AfterCommitRegistry {
    private final List<CallbackEntry> entries = new ArrayList<>();

    void register(Runnable callback, long scopeId) {
        entries.add(new CallbackEntry(callback, scopeId));
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    int size() {
        return entries.size();
    }

    List<Runnable> pendingCallbacks() {
        List<Runnable> callbacks = new ArrayList<>(entries.size());
        for (CallbackEntry entry : entries) {
            callbacks.add(entry.callback());
        }
        return List.copyOf(callbacks);
    }

    /**
     * Removes and returns the entries bound to {@code scopeId}, in registration order.
     */
    List<CallbackEntry> take(long scopeId) {
        List<CallbackEntry> taken = new ArrayList<>();
        Iterator<CallbackEntry> it = entries.iterator();
        while (it.hasNext()) {
            CallbackEntry entry = it.next();
            if (entry.boundScopeId() == scopeId) {
                taken.add(entry);
                it.remove();
            }
        }
        return taken;
    }

    List<CallbackEntry> takeAll() {
        List<CallbackEntry> taken = List.copyOf(entries);
        entries.clear();
        return taken;
    }

    /**
     * Drops the entries bound to {@code scopeId} without running them.
     *
     * @return number of entries dropped
     */
    int discard(long scopeId) {
        return take(scopeId).size();
    }

    void clear() {
        entries.clear();
    }
}
