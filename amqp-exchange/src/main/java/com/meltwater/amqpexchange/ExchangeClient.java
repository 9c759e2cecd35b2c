package com.meltwater.amqpexchange;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.meltwater.amqpexchange.impl.DefaultConnectionManager;
import com.meltwater.amqpexchange.impl.SingleChannelConsumer;
import com.meltwater.amqpexchange.impl.SingleChannelPublisher;
import com.meltwater.amqpexchange.util.Logger;
import rx.Single;
import rx.schedulers.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for publishing, consuming and remote procedure calls against one broker profile.
 *
 * Every operation resolves its {@link PropertyOverrides} against the base profile given at construction,
 * opens its own {@link Request} and always shuts it down before returning. Operations can therefore be called
 * from several threads, except for the batch which belongs to the client instance and is guarded by it.
 *
 * <pre>
 * ExchangeClient client = new ExchangeClient(new AmqpProperties.Builder("exchange: 'orders', exchange_type: 'topic'").build());
 * client.publish("orders.created", "{\"id\":1}", PropertyOverrides.none());
 * client.consume("orders-q", (message, resolver) -&gt; {
 *     process(message);
 *     resolver.acknowledge(message);
 * }, PropertyOverrides.of(Property.message_limit, 1));
 * </pre>
 */
public class ExchangeClient {

    private static final Logger log = new Logger(ExchangeClient.class);

    public static final String LISTENER_QUEUE_PREFIX = "listener-";

    private final AmqpProperties base;
    private final PropertyResolver resolver;
    private final ConnectionManagerFactory connectionManagerFactory;
    private final PublisherFactory publisherFactory;
    private final ConsumerFactory consumerFactory;
    private final RpcClient rpcClient;
    private final MessageFactory messageFactory;

    private final List<Staged> batch = new ArrayList<>();

    public ExchangeClient(AmqpProperties base) {
        this(base, DefaultConnectionManager.factory());
    }

    public ExchangeClient(AmqpProperties base, ConnectionManagerFactory connectionManagerFactory) {
        this(base, new PropertyResolver(), connectionManagerFactory, SingleChannelPublisher::new, SingleChannelConsumer::new);
    }

    public ExchangeClient(AmqpProperties base,
                          PropertyResolver resolver,
                          ConnectionManagerFactory connectionManagerFactory,
                          PublisherFactory publisherFactory,
                          ConsumerFactory consumerFactory) {
        this.base = base;
        this.resolver = resolver;
        this.connectionManagerFactory = connectionManagerFactory;
        this.publisherFactory = publisherFactory;
        this.consumerFactory = consumerFactory;
        this.rpcClient = new RpcClient(base, resolver, connectionManagerFactory, publisherFactory, consumerFactory);
        this.messageFactory = new MessageFactory(base);
    }

    /**
     * Publishes one message. The message is sent as mandatory when the {@link Property#mandatory} setting is true.
     *
     * @see Publisher#publish(String, Message, boolean)
     */
    public boolean publish(String routingKey, Message message, PropertyOverrides overrides) throws IOException, TimeoutException {
        final AmqpProperties properties = resolver.resolve(base, orNone(overrides));
        try (Request request = newRequest(properties)) {
            request.setup();
            Publisher publisher = publisherFactory.createPublisher(request.getChannel(), properties);
            return publisher.publish(routingKey, message, properties.mandatory);
        }
    }

    public boolean publish(String routingKey, String body, PropertyOverrides overrides) throws IOException, TimeoutException {
        return publish(routingKey, messageFactory.create(body), overrides);
    }

    public synchronized void batchBasicPublish(String routingKey, Message message) {
        batch.add(new Staged(routingKey, message));
    }

    public void batchBasicPublish(String routingKey, String body) {
        batchBasicPublish(routingKey, messageFactory.create(body));
    }

    /**
     * Sends every staged message on one request. Messages that were sent leave the batch even when a later one
     * fails, so calling it again only sends the rest.
     *
     * @return the number of messages sent
     */
    public synchronized int batchPublish(PropertyOverrides overrides) throws IOException, TimeoutException {
        if (batch.isEmpty()) {
            return 0;
        }
        final AmqpProperties properties = resolver.resolve(base, orNone(overrides));
        Publisher publisher = null;
        try (Request request = newRequest(properties)) {
            request.setup();
            publisher = publisherFactory.createPublisher(request.getChannel(), properties);
            for (Staged staged : batch) {
                publisher.batchBasicPublish(staged.routingKey, staged.message);
            }
            return publisher.batchPublish();
        } finally {
            if (publisher != null) {
                final int sent = batch.size() - publisher.pendingBatchSize();
                batch.subList(0, sent).clear();
                if (!batch.isEmpty()) {
                    log.warnWithParams("Batch partly sent. The rest stays staged.",
                            "sent", sent,
                            "pending", batch.size());
                }
            }
        }
    }

    public synchronized int pendingBatchSize() {
        return batch.size();
    }

    /**
     * Runs a consume loop on the given queue, declaring it (and its bindings) according to the resolved properties.
     */
    public ConsumeResult consume(String queue, MessageHandler handler, PropertyOverrides overrides) throws IOException, TimeoutException {
        final AmqpProperties properties = resolver.resolve(base, orNone(overrides).plus(PropertyOverrides.of(Property.queue, queue)));
        return consume(properties, handler);
    }

    /**
     * Runs {@link #consume(String, MessageHandler, PropertyOverrides)} on the io scheduler.
     */
    public Single<ConsumeResult> consumeAsync(String queue, MessageHandler handler, PropertyOverrides overrides) {
        return Single.fromCallable(() -> consume(queue, handler, overrides))
                .subscribeOn(Schedulers.io());
    }

    /**
     * Binds a queue to every given routing key and consumes it. Unless the overrides name a queue, a queue named
     * {@code listener-<uuid>} is declared, which is deleted once the loop ends.
     *
     * @throws IllegalArgumentException if no routing key is given
     */
    public ConsumeResult listen(List<String> routingKeys, MessageHandler handler, PropertyOverrides overrides) throws IOException, TimeoutException {
        if (routingKeys == null || routingKeys.isEmpty()) {
            throw new IllegalArgumentException("Routing keys must be a non-empty string or list");
        }
        final PropertyOverrides callOverrides = orNone(overrides);
        PropertyOverrides listenerOverrides = PropertyOverrides.of(Property.routing, routingKeys);
        final Object queue = callOverrides.get(Property.queue);
        if (queue == null || ((String) queue).isEmpty()) {
            listenerOverrides
                    .with(Property.queue, LISTENER_QUEUE_PREFIX + UUID.randomUUID())
                    .with(Property.queue_auto_delete, true)
                    .with(Property.queue_durable, false);
        }
        final AmqpProperties properties = resolver.resolve(base, callOverrides.plus(listenerOverrides));
        log.infoWithParams("Listening.",
                "queue", properties.queue,
                "exchange", properties.exchange,
                "routingKeys", routingKeys);
        return consume(properties, handler);
    }

    /**
     * @param routingKeys one routing key or a comma separated list of them
     */
    public ConsumeResult listen(String routingKeys, MessageHandler handler, PropertyOverrides overrides) throws IOException, TimeoutException {
        if (Strings.isNullOrEmpty(routingKeys) || routingKeys.trim().isEmpty()) {
            throw new IllegalArgumentException("Routing keys must be a non-empty string or list");
        }
        return listen(ImmutableList.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(routingKeys)), handler, overrides);
    }

    /**
     * @return the reply body or null if no reply arrived within the timeout
     * @see RpcClient#call(String, Message, PropertyOverrides, int)
     */
    public byte[] rpc(String routingKey, Message request, PropertyOverrides overrides, int timeoutSecs) throws IOException, TimeoutException {
        return rpcClient.call(routingKey, request, overrides, timeoutSecs);
    }

    public String rpc(String routingKey, String request, PropertyOverrides overrides, int timeoutSecs) throws IOException, TimeoutException {
        final byte[] response = rpc(routingKey, messageFactory.create(request), overrides, timeoutSecs);
        return response == null ? null : new String(response, StandardCharsets.UTF_8);
    }

    public Single<byte[]> rpcAsync(String routingKey, Message request, PropertyOverrides overrides, int timeoutSecs) {
        return rpcClient.callAsync(routingKey, request, overrides, timeoutSecs);
    }

    /**
     * Serves remote procedure calls from the given queue: every request is passed to the handler, its result is sent
     * to the reply-to queue of the request and the request is acknowledged. Requests without reply-to are acknowledged
     * without a reply.
     */
    public ConsumeResult serve(String queue, RpcHandler rpcHandler, PropertyOverrides overrides) throws IOException, TimeoutException {
        return consume(queue, (message, resolver) -> {
            final byte[] response = rpcHandler.handle(message);
            if (Strings.isNullOrEmpty(message.getReplyTo())) {
                log.warnWithParams("Rpc request without reply_to. No reply sent.",
                        "queue", queue,
                        "correlationId", message.getCorrelationId());
            } else {
                resolver.reply(message, messageFactory.create(response == null ? new byte[0] : response));
            }
            resolver.acknowledge(message);
        }, overrides);
    }

    /**
     * @return a message builder with the defaults of the profile filled in
     */
    public Message.Builder message(String body) {
        return messageFactory.builder(body);
    }

    private ConsumeResult consume(AmqpProperties properties, MessageHandler handler) throws IOException, TimeoutException {
        try (Request request = newRequest(properties)) {
            final QueueInfo queueInfo = request.setup();
            Publisher replyPublisher = publisherFactory.createPublisher(request.getChannel(), properties);
            QueueConsumer consumer = consumerFactory.createConsumer(request.getChannel(), properties, replyPublisher);
            return consumer.consume(queueInfo, handler);
        }
    }

    private static PropertyOverrides orNone(PropertyOverrides overrides) {
        return overrides == null ? PropertyOverrides.none() : overrides;
    }

    private Request newRequest(AmqpProperties properties) {
        return new Request(properties, connectionManagerFactory.create(properties));
    }

    private static class Staged {
        final String routingKey;
        final Message message;

        Staged(String routingKey, Message message) {
            this.routingKey = routingKey;
            this.message = message;
        }
    }
}
