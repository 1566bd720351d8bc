/**
 * {@code ok} / {@code degraded} health report over the pipeline's dependencies.
 */
package mailrelay.health;
