package mailrelay.relay;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void delayDoublesEachAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100_000);

    assertEquals(100, policy.computeDelayMs(1));
    assertEquals(200, policy.computeDelayMs(2));
    assertEquals(400, policy.computeDelayMs(3));
    assertEquals(800, policy.computeDelayMs(4));
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    assertEquals(400, policy.computeDelayMs(3));
    assertEquals(500, policy.computeDelayMs(4));
    assertEquals(500, policy.computeDelayMs(40));
    assertEquals(500, policy.computeDelayMs(Integer.MAX_VALUE));
  }

  @Test
  void nonPositiveAttemptsHaveNoDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    assertEquals(0, policy.computeDelayMs(0));
    assertEquals(0, policy.computeDelayMs(-3));
  }

  @Test
  void jitterStaysWithinBoundsAndCap() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 3000, 0.5);

    for (int i = 0; i < 100; i++) {
      long first = policy.computeDelayMs(1);
      assertTrue(first >= 500 && first < 1500, "got " + first);
      long capped = policy.computeDelayMs(5);
      assertTrue(capped >= 1500 && capped <= 3000, "got " + capped);
    }
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 50));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 500, 1.0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 500, -0.1));
  }
}
