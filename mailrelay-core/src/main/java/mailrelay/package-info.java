/**
 * Transactional outbox for email with a queue-backed relay and at-least-once delivery.
 *
 * <h2>Core Design</h2>
 * <p>{@link mailrelay.EmailEnqueuer} inserts a PENDING {@linkplain mailrelay.model.OutboxEntry
 * outbox entry} <em>within</em> the caller's transaction. After commit it publishes
 * {@code {"outbox_id": "..."}} to a durable queue. A {@linkplain mailrelay.relay.RelayConsumer
 * relay} consumes the notification, loads the entry and sends it with a bounded number of
 * attempts, then marks it SENT or FAILED and acknowledges. Failures of the relay's own
 * dependencies leave the notification unacknowledged so the broker redelivers it.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>mailrelay-core</b>: model, SPIs, enqueue path, relay, resilience (no external deps
 *       besides the id generator)</li>
 *   <li><b>mailrelay-jdbc</b>: JDBC outbox store (H2, MySQL, PostgreSQL) and transactions</li>
 *   <li><b>mailrelay-rabbitmq</b>, <b>mailrelay-smtp</b>, <b>mailrelay-redis</b>: broker,
 *       transport and cache adapters</li>
 *   <li><b>mailrelay-spring-adapter</b>, <b>mailrelay-spring-boot-starter</b>: Spring wiring</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var store        = JdbcOutboxEntryStores.detect(dataSource);
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * var txContext    = new ThreadLocalTxContext();
 *
 * try (MailRelay mail = MailRelay.producer()
 *     .connectionProvider(connProvider)
 *     .txContext(txContext)
 *     .outboxStore(store)
 *     .brokerChannel(new RabbitBrokerChannel(RabbitSettings.defaults()))
 *     .build()) {
 *
 *   var txManager = new JdbcTransactionManager(connProvider, txContext);
 *   try (var tx = txManager.begin()) {
 *     mail.enqueuer().enqueue(messageId, List.of("a@example.com"), "Hi", "Body");
 *     tx.commit(); // throws DispatchUnavailableException if the broker is down
 *   }
 * }
 * }</pre>
 *
 * @see mailrelay.MailRelay
 * @see mailrelay.EmailEnqueuer
 */
package mailrelay;
