package mailrelay.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.MessageProperties;
import com.rabbitmq.client.ShutdownSignalException;
import mailrelay.resilience.ConnectionUnavailableException;
import mailrelay.resilience.ReconnectingConnection;
import mailrelay.spi.BrokerChannel;
import mailrelay.spi.BrokerException;
import mailrelay.spi.Delivery;
import mailrelay.util.DaemonThreadFactory;
import mailrelay.util.Sleeper;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BrokerChannel} over a single RabbitMQ connection.
 *
 * <p>Messages go to the default exchange with the queue name as routing key, marked persistent,
 * and each publish waits for the broker's confirm. A failed publish discards both the publish
 * channel and the connection so the next call starts over.
 *
 * <p>Consumers run with manual acknowledgement and the configured prefetch. When a consumer's
 * channel shuts down for any reason other than {@link BrokerChannel.Subscription#cancel()} or
 * {@link #close()}, a background thread waits for the connection to come back and attaches the
 * consumer again. Unacknowledged deliveries are redelivered by the broker in the meantime.
 */
public final class RabbitBrokerChannel implements BrokerChannel {
  private static final Logger logger = Logger.getLogger(RabbitBrokerChannel.class.getName());

  private final RabbitSettings settings;
  private final ReconnectingConnection<Connection> connection;
  private final Sleeper sleeper;
  private final ExecutorService reattachExecutor;
  private final List<RabbitSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final Object publishLock = new Object();

  private Channel publishChannel;
  private volatile boolean closed;

  public RabbitBrokerChannel(RabbitSettings settings) {
    this(settings, newConnectionFactory(settings), Sleeper.SYSTEM);
  }

  RabbitBrokerChannel(RabbitSettings settings, ConnectionFactory factory, Sleeper sleeper) {
    this.settings = Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(factory, "factory");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.connection = ReconnectingConnection.<Connection>builder("RabbitMQ",
            () -> factory.newConnection("mailrelay"))
        .openCheck(Connection::isOpen)
        .closer(Connection::close)
        .policy(settings.reconnect())
        .sleeper(sleeper)
        .build();
    this.reattachExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("rabbit-reattach"));
  }

  static ConnectionFactory newConnectionFactory(RabbitSettings settings) {
    ConnectionFactory factory = new ConnectionFactory();
    try {
      factory.setUri(settings.uri());
    } catch (URISyntaxException | GeneralSecurityException e) {
      throw new IllegalArgumentException("Invalid AMQP URI", e);
    }
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    factory.setConnectionTimeout(settings.connectTimeoutMs());
    return factory;
  }

  @Override
  public void connect() {
    Connection open;
    try {
      open = connection.connectAtStartup();
    } catch (ConnectionUnavailableException e) {
      throw new BrokerException("Broker unreachable: " + e.getMessage(), e.getCause());
    }
    try (Channel channel = open.createChannel()) {
      declareQueue(channel);
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      connection.discard();
      throw new BrokerException("Failed to declare queue " + settings.queue(), e);
    }
    logger.info("Connected to RabbitMQ, queue " + settings.queue());
  }

  @Override
  public void publish(byte[] payload) {
    Objects.requireNonNull(payload, "payload");
    synchronized (publishLock) {
      try {
        Channel channel = ensurePublishChannel();
        channel.basicPublish("", settings.queue(), MessageProperties.PERSISTENT_BASIC, payload);
        channel.waitForConfirmsOrDie(settings.confirmTimeoutMs());
      } catch (ConnectionUnavailableException e) {
        throw new BrokerException("Broker unavailable: " + e.getMessage(), e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        resetAfterPublishFailure();
        throw new BrokerException("Interrupted while waiting for publish confirm", e);
      } catch (IOException | TimeoutException | ShutdownSignalException e) {
        resetAfterPublishFailure();
        throw new BrokerException("Publish to " + settings.queue() + " failed", e);
      }
    }
  }

  // Caller holds publishLock.
  private Channel ensurePublishChannel() throws IOException {
    if (publishChannel != null && publishChannel.isOpen()) {
      return publishChannel;
    }
    Connection open = connection.ensureConnected();
    Channel channel = open.createChannel();
    declareQueue(channel);
    channel.confirmSelect();
    publishChannel = channel;
    return channel;
  }

  // Caller holds publishLock.
  private void resetAfterPublishFailure() {
    Channel stale = publishChannel;
    publishChannel = null;
    if (stale != null) {
      abortQuietly(stale);
    }
    connection.discard();
  }

  private void declareQueue(Channel channel) throws IOException {
    channel.queueDeclare(settings.queue(), true, false, false, null);
  }

  @Override
  public Subscription subscribe(DeliveryHandler handler) {
    Objects.requireNonNull(handler, "handler");
    if (closed) {
      throw new BrokerException("Broker channel is closed");
    }
    RabbitSubscription subscription = new RabbitSubscription(handler);
    try {
      subscription.attach(connection.ensureConnected());
    } catch (ConnectionUnavailableException e) {
      throw new BrokerException("Broker unavailable: " + e.getMessage(), e.getCause());
    } catch (IOException | ShutdownSignalException e) {
      throw new BrokerException("Failed to consume from " + settings.queue(), e);
    }
    subscriptions.add(subscription);
    return subscription;
  }

  public RabbitSettings settings() {
    return settings;
  }

  @Override
  public boolean isOpen() {
    return !closed && connection.isConnected();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (RabbitSubscription subscription : subscriptions) {
      subscription.cancel();
    }
    synchronized (publishLock) {
      if (publishChannel != null) {
        abortQuietly(publishChannel);
        publishChannel = null;
      }
    }
    reattachExecutor.shutdownNow();
    connection.close();
  }

  private static void abortQuietly(Channel channel) {
    try {
      channel.abort();
    } catch (IOException | RuntimeException e) {
      logger.log(Level.FINE, "Ignoring failure while aborting channel", e);
    }
  }

  private final class RabbitSubscription implements Subscription {
    private final DeliveryHandler handler;
    private final AtomicBoolean reattaching = new AtomicBoolean(false);
    private volatile boolean cancelled;
    private volatile Channel channel;
    private volatile String consumerTag;

    RabbitSubscription(DeliveryHandler handler) {
      this.handler = handler;
    }

    void attach(Connection open) throws IOException {
      Channel consumerChannel = open.createChannel();
      declareQueue(consumerChannel);
      consumerChannel.basicQos(settings.prefetch());
      channel = consumerChannel;
      consumerTag = consumerChannel.basicConsume(settings.queue(), false, new Consumer(consumerChannel));
      logger.info("Consuming from " + settings.queue() + " with prefetch " + settings.prefetch());
    }

    void onShutdown(String reason) {
      if (cancelled || closed) {
        return;
      }
      logger.warning("Consumer on " + settings.queue() + " stopped: " + reason);
      if (reattaching.compareAndSet(false, true)) {
        try {
          reattachExecutor.execute(this::reattach);
        } catch (RejectedExecutionException e) {
          reattaching.set(false);
          logger.log(Level.FINE, "Reattach skipped; channel closing", e);
        }
      }
    }

    private void reattach() {
      int failures = 0;
      try {
        Channel stale = channel;
        if (stale != null && stale.isOpen()) {
          abortQuietly(stale);
        }
        while (!cancelled && !closed) {
          try {
            attach(connection.awaitReconnect());
            return;
          } catch (ConnectionUnavailableException e) {
            logger.log(Level.FINE, "Connection closed while reattaching consumer", e);
            return;
          } catch (IOException | ShutdownSignalException e) {
            failures++;
            long delayMs = settings.reconnect().backoff().computeDelayMs(failures);
            logger.log(Level.WARNING, "Reattaching consumer to " + settings.queue()
                + " failed; retry in " + delayMs + " ms", e);
            sleeper.sleep(delayMs);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        reattaching.set(false);
      }
    }

    @Override
    public void cancel() {
      cancelled = true;
      subscriptions.remove(this);
      Channel current = channel;
      if (current == null || !current.isOpen()) {
        return;
      }
      try {
        current.basicCancel(consumerTag);
      } catch (IOException | RuntimeException e) {
        logger.log(Level.FINE, "Ignoring failure while cancelling consumer", e);
      }
    }

    private final class Consumer extends DefaultConsumer {
      Consumer(Channel channel) {
        super(channel);
      }

      @Override
      public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties,
          byte[] body) {
        RabbitDelivery delivery = new RabbitDelivery(getChannel(), envelope.getDeliveryTag(),
            body, envelope.isRedeliver());
        try {
          handler.onDelivery(delivery);
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Delivery handler failed; returning message to queue", e);
          delivery.requeueIfUnsettled();
        }
      }

      @Override
      public void handleShutdownSignal(String tag, ShutdownSignalException signal) {
        onShutdown(signal.getMessage());
      }

      @Override
      public void handleCancel(String tag) {
        onShutdown("cancelled by broker");
      }
    }
  }

  static final class RabbitDelivery implements Delivery {
    private final Channel channel;
    private final long deliveryTag;
    private final byte[] body;
    private final boolean redelivered;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    RabbitDelivery(Channel channel, long deliveryTag, byte[] body, boolean redelivered) {
      this.channel = channel;
      this.deliveryTag = deliveryTag;
      this.body = body;
      this.redelivered = redelivered;
    }

    @Override
    public byte[] body() {
      return body;
    }

    @Override
    public boolean redelivered() {
      return redelivered;
    }

    @Override
    public void ack() {
      settle();
      try {
        channel.basicAck(deliveryTag, false);
      } catch (IOException | ShutdownSignalException e) {
        throw new BrokerException("Failed to ack delivery " + deliveryTag, e);
      }
    }

    @Override
    public void requeue() {
      settle();
      try {
        channel.basicNack(deliveryTag, false, true);
      } catch (IOException | ShutdownSignalException e) {
        throw new BrokerException("Failed to requeue delivery " + deliveryTag, e);
      }
    }

    void requeueIfUnsettled() {
      if (settled.get()) {
        return;
      }
      try {
        requeue();
      } catch (BrokerException | IllegalStateException e) {
        logger.log(Level.WARNING, "Could not requeue delivery " + deliveryTag
            + "; broker redelivers it once the channel closes", e);
      }
    }

    private void settle() {
      if (!settled.compareAndSet(false, true)) {
        throw new IllegalStateException("Delivery " + deliveryTag + " already settled");
      }
    }
  }
}
