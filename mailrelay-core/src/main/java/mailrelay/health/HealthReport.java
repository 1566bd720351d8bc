package mailrelay.health;

/**
 * Snapshot of the pipeline's dependencies.
 *
 * @param database {@code true} if the outbox store answered
 * @param broker   {@code true} if the broker connection is open
 * @param cache    {@code true} if the cache answered, or no cache is configured
 */
public record HealthReport(boolean database, boolean broker, boolean cache) {

  public static final String OK = "ok";
  public static final String DEGRADED = "degraded";

  public boolean healthy() {
    return database && broker && cache;
  }

  /**
   * Returns {@code "ok"} when every dependency is up, {@code "degraded"} otherwise.
   */
  public String status() {
    return healthy() ? OK : DEGRADED;
  }
}
