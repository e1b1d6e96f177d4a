package io.subatomic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-connection stack of open scopes, innermost on top.
 *
 * <p>Plain data structure: it neither validates nesting nor talks to the database.
 * Scope operations push and pop in matching pairs from their own cleanup paths.
 */
final class ScopeStack {
    private static final AtomicLong SCOPE_IDS = new AtomicLong();

    private final Deque<ScopeFrame> frames = new ArrayDeque<>();

    static long nextScopeId() {
        return SCOPE_IDS.incrementAndGet();
    }

    boolean isOpen() {
        return !frames.isEmpty();
    }

    int depth() {
        return frames.size();
    }

    /**
     * Returns the innermost frame, or {@code null} if the stack is empty.
     */
    ScopeFrame peek() {
        return frames.peekFirst();
    }

    /**
     * Returns the bottom frame if it is a {@link ScopeKind#ROOT} frame, else {@code null}.
     */
    ScopeFrame outermostRoot() {
        ScopeFrame bottom = frames.peekLast();
        return bottom != null && bottom.kind() == ScopeKind.ROOT ? bottom : null;
    }

    boolean contains(ScopeFrame frame) {
        return frames.contains(frame);
    }

    ScopeFrame push(ScopeKind kind, long scopeId, String savepointName) {
        ScopeFrame frame = new ScopeFrame(kind, frames.size() + 1, scopeId, savepointName);
        frames.addFirst(frame);
        return frame;
    }

    /**
     * Removes and returns the innermost frame, or {@code null} if the stack is empty.
     */
    ScopeFrame pop() {
        return frames.pollFirst();
    }

    void clear() {
        frames.clear();
    }
}
