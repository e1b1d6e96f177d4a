/**
 * Micrometer bridge for exporting scope and callback counters.
 *
 * @see io.subatomic.micrometer.MicrometerMetricsExporter
 */
package io.subatomic.micrometer;
