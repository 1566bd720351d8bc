package mailrelay.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates daemon threads named {@code mailrelay-<role>-1}, {@code mailrelay-<role>-2}, and so on.
 *
 * <p>Uncaught exceptions are logged instead of being printed to stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String role;
  private final AtomicInteger sequence = new AtomicInteger();

  public DaemonThreadFactory(String role) {
    this.role = Objects.requireNonNull(role, "role");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, "mailrelay-" + role + "-" + sequence.incrementAndGet());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
    return thread;
  }
}
