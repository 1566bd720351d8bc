/**
 * Small shared utilities: thread naming, JSON codec and the injectable sleeper.
 */
package mailrelay.util;
