package mailrelay.relay;

/**
 * Strategy for computing the pause before the next attempt of a failed operation.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds after the given number of failed attempts.
     *
     * @param attempts failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
