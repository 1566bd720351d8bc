package mailrelay.demo.notifier;

import mailrelay.MailRelay;
import mailrelay.health.HealthReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Publishes the relay's dependency status under {@code /actuator/health/pipeline}.
 */
@Component("pipeline")
public class PipelineHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(PipelineHealthIndicator.class);

    private final MailRelay mailRelay;

    public PipelineHealthIndicator(MailRelay mailRelay) {
        this.mailRelay = mailRelay;
    }

    @Override
    public Health health() {
        HealthReport report = mailRelay.health().check();
        Health.Builder builder = report.healthy() ? Health.up() : Health.down();
        if (!report.healthy()) {
            log.warn("Pipeline degraded: database={}, broker={}, cache={}",
                    report.database(), report.broker(), report.cache());
        }
        return builder
                .withDetail("status", report.status())
                .withDetail("database", report.database())
                .withDetail("broker", report.broker())
                .withDetail("cache", report.cache())
                .withDetail("failedEntries", mailRelay.failedEntries().count())
                .build();
    }
}
