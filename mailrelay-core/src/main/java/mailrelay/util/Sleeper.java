package mailrelay.util;

/**
 * Blocking pause between retry attempts. Tests inject a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
