package io.subatomic.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised while issuing transaction control SQL.
 */
public final class TransactionBackendException extends RuntimeException {
    public TransactionBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
