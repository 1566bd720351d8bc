package mailrelay.demo.notifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Notifier process: consumes {@code email.send} and delivers mail over SMTP.
 *
 * <p>Everything is wired by the starter from {@code application.yml}; SIGTERM closes the
 * context, which drains in-flight deliveries before the broker connection is released.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/mailrelay-notifier/pom.xml spring-boot:run
 *
 * <p>Endpoints:
 * GET /actuator/health/pipeline  - database, broker and cache status, failed entry count
 * GET /actuator/metrics          - mailrelay.* counters and gauges
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
