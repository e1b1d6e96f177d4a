package io.subatomic;

/** Kind of a {@link ScopeFrame} on a connection's {@link ScopeStack}. */
enum ScopeKind {
    /** Outermost frame of a transaction; after-commit callbacks bind to it. */
    ROOT,
    /** Savepoint nested inside a transaction. */
    SAVEPOINT
}
