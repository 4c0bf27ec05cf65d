/**
 * Micrometer bridge for exporting fan-out metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.fanout.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.fanout.spi.MetricsExporter} SPI using Micrometer counters, gauges and
 * distribution summaries tagged with the channel name.
 *
 * @see io.fanout.micrometer.MicrometerMetricsExporter
 */
package io.fanout.micrometer;
