package io.subatomic;

/**
 * One open scope on a connection.
 *
 * @param kind          root or savepoint
 * @param depth         1 for the bottom frame, increasing towards the top
 * @param scopeId       process-unique id; after-commit callbacks bind to the root's id
 * @param savepointName SQL savepoint backing this frame, or {@code null} when a root
 *                      frame began a real transaction
 */
record ScopeFrame(ScopeKind kind, int depth, long scopeId, String savepointName) {
}
