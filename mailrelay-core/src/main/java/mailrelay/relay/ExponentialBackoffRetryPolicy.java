package mailrelay.relay;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code baseDelay * 2^(attempts-1)}, capped at {@code maxDelay}.
 *
 * <p>With a non-zero {@code jitter} the delay is scaled by a random factor in
 * {@code [1 - jitter, 1 + jitter)} and capped again. Reconnect loops use jitter so that
 * several relays do not hammer a recovering broker in lockstep; the delivery loop does not.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, 0.0);
  }

  /**
   * @param baseDelayMs delay after the first failure (milliseconds)
   * @param maxDelayMs  cap on any delay (milliseconds)
   * @param jitter      relative jitter in {@code [0, 1)}
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long delay;
    if (attempts >= 63 || (1L << (attempts - 1)) > maxDelayMs / baseDelayMs) {
      delay = maxDelayMs;
    } else {
      delay = Math.min(maxDelayMs, baseDelayMs << (attempts - 1));
    }
    if (jitter == 0.0) {
      return delay;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
    return Math.min(maxDelayMs, Math.max(0L, (long) (delay * factor)));
  }
}
