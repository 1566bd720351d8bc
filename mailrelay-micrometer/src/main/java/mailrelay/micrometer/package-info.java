/**
 * Micrometer bridge for exporting mail relay metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link mailrelay.micrometer.MicrometerMetricsExporter} implements the
 * {@link mailrelay.spi.MetricsExporter} SPI using Micrometer counters, a gauge and a
 * distribution summary.
 */
package mailrelay.micrometer;
