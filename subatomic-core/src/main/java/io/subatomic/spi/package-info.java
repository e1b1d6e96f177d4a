/**
 * Service provider interfaces for plugging in the database layer and metrics.
 *
 * <ul>
 *   <li>{@link io.subatomic.spi.TransactionBackend} — SQL-level transaction control per connection</li>
 *   <li>{@link io.subatomic.spi.BackendRegistry} — alias to backend lookup</li>
 *   <li>{@link io.subatomic.spi.MetricsExporter} — counters for scopes and callbacks</li>
 * </ul>
 */
package io.subatomic.spi;
