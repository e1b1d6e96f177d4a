/**
 * JDBC transaction backends.
 *
 * <p>{@link io.subatomic.jdbc.JdbcBackendRegistry} maps each alias to a
 * {@link io.subatomic.jdbc.JdbcTransactionBackend} driving a per-thread connection from
 * a {@link io.subatomic.jdbc.ConnectionProvider}.
 *
 * @see io.subatomic.Subatomic
 */
package io.subatomic.jdbc;
