/**
 * Optional catch-up scan that republishes notifications for stale PENDING entries.
 */
package mailrelay.backfill;
