package mailrelay.resilience;

import mailrelay.relay.ExponentialBackoffRetryPolicy;
import mailrelay.relay.RetryPolicy;

import java.util.Objects;

/**
 * How a {@link ReconnectingConnection} retries.
 *
 * @param startupAttempts connect attempts at startup before giving up (fail fast)
 * @param backoff         delay after the n-th consecutive failure, at startup and while running
 */
public record ReconnectPolicy(int startupAttempts, RetryPolicy backoff) {

  public ReconnectPolicy {
    if (startupAttempts < 1) {
      throw new IllegalArgumentException("startupAttempts must be >= 1, got: " + startupAttempts);
    }
    Objects.requireNonNull(backoff, "backoff");
  }

  /**
   * Five startup attempts; backoff from 500 ms doubling to 30 s with 20% jitter.
   */
  public static ReconnectPolicy defaults() {
    return new ReconnectPolicy(5, new ExponentialBackoffRetryPolicy(500, 30_000, 0.2));
  }

  public static ReconnectPolicy of(int startupAttempts, long baseDelayMs, long maxDelayMs) {
    return new ReconnectPolicy(startupAttempts,
        new ExponentialBackoffRetryPolicy(baseDelayMs, maxDelayMs, 0.2));
  }
}
