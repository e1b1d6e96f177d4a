package io.subatomic;

/**
 * A deferred after-commit callback.
 *
 * @param callback     action to run after commit
 * @param boundScopeId id of the outermost scope that was open when the callback was registered
 */
record CallbackEntry(Runnable callback, long boundScopeId) {
}
