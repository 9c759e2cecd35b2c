package com.meltwater.amqpexchange;

import com.meltwater.amqpexchange.util.Logger;
import rx.Single;
import rx.schedulers.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Turns a request and its asynchronous reply into a blocking call.
 *
 * Every call uses its own {@link Request}: the request message is published with a correlation id and a reply-to queue,
 * then a consume loop waits on the reply queue until the reply with the same correlation id arrives or the timeout expires.
 *
 * @see ReplyQueueMode
 */
public class RpcClient {

    private static final Logger log = new Logger(RpcClient.class);

    private final AmqpProperties base;
    private final PropertyResolver resolver;
    private final ConnectionManagerFactory connectionManagerFactory;
    private final PublisherFactory publisherFactory;
    private final ConsumerFactory consumerFactory;

    public RpcClient(AmqpProperties base,
                     PropertyResolver resolver,
                     ConnectionManagerFactory connectionManagerFactory,
                     PublisherFactory publisherFactory,
                     ConsumerFactory consumerFactory) {
        this.base = base;
        this.resolver = resolver;
        this.connectionManagerFactory = connectionManagerFactory;
        this.publisherFactory = publisherFactory;
        this.consumerFactory = consumerFactory;
    }

    /**
     * @param timeoutSecs the max time to wait for the reply, 0 or less means the {@link Property#rpc_timeout_secs} setting
     * @return the body of the reply or null if no reply arrived in time
     */
    public byte[] call(String routingKey, Message request, PropertyOverrides overrides, int timeoutSecs) throws IOException, TimeoutException {
        final AmqpProperties properties = resolver.resolve(base, overrides);
        final int timeout = timeoutSecs > 0 ? timeoutSecs : properties.rpc_timeout_secs;
        final String correlationId = request.getCorrelationId() != null ? request.getCorrelationId() : UUID.randomUUID().toString();
        final ReplyQueueMode mode = ReplyQueueMode.of(properties);
        final AmqpProperties replyProperties = replyProperties(properties, mode, timeout);

        try (Request rpcRequest = new Request(replyProperties, connectionManagerFactory.create(replyProperties))) {
            final QueueInfo replyQueue = rpcRequest.setup();
            if (mode == ReplyQueueMode.exclusive_per_call) {
                rpcRequest.getChannel().queueBind(replyQueue.name, replyProperties.exchange, replyQueue.name);
            }

            final Publisher publisher = publisherFactory.createPublisher(rpcRequest.getChannel(), properties);
            final Message message = request.toBuilder()
                    .withCorrelationId(correlationId)
                    .withReplyTo(replyQueue.name)
                    .build();
            log.debugWithParams("Sending rpc request.",
                    "routingKey", routingKey,
                    "correlationId", correlationId,
                    "replyTo", replyQueue.name,
                    "mode", mode,
                    "timeoutSecs", timeout);
            if (!publisher.publish(routingKey, message, properties.mandatory)) {
                log.warnWithParams("Rpc request was not accepted by the broker.",
                        "routingKey", routingKey,
                        "correlationId", correlationId);
                return null;
            }

            final ReplyHandler handler = new ReplyHandler(correlationId, mode, properties.rpc_max_foreign_redeliveries);
            final QueueConsumer consumer = consumerFactory.createConsumer(rpcRequest.getChannel(), replyProperties, publisher);
            final ConsumeResult result = consumer.consume(replyQueue, handler);
            if (handler.response == null) {
                log.warnWithParams("No rpc reply received in time.",
                        "routingKey", routingKey,
                        "correlationId", correlationId,
                        "timeoutSecs", timeout,
                        "loopState", result.state);
            }
            return handler.response;
        }
    }

    public String call(String routingKey, String request, PropertyOverrides overrides, int timeoutSecs) throws IOException, TimeoutException {
        final byte[] response = call(routingKey, Message.builder(request).build(), overrides, timeoutSecs);
        return response == null ? null : new String(response, StandardCharsets.UTF_8);
    }

    /**
     * Performs the call on the io scheduler. The single emits null if no reply arrived in time.
     */
    public Single<byte[]> callAsync(String routingKey, Message request, PropertyOverrides overrides, int timeoutSecs) {
        return Single.fromCallable(() -> call(routingKey, request, overrides, timeoutSecs))
                .subscribeOn(Schedulers.io());
    }

    static AmqpProperties replyProperties(AmqpProperties properties, ReplyQueueMode mode, int timeoutSecs) {
        AmqpProperties.Builder builder = properties.toBuilder()
                .with(Property.routing, Collections.emptyList())
                .with(Property.persistent, true)
                .with(Property.message_limit, 0)
                .with(Property.timeout_secs, 0)
                .with(Property.max_duration_secs, timeoutSecs)
                .with(Property.consumer_no_ack, false)
                .with(Property.consumer_tag, "")
                .with(Property.shutdown_signal, null);
        if (mode == ReplyQueueMode.exclusive_per_call) {
            builder.with(Property.queue, "")
                    .with(Property.queue_force_declare, true)
                    .with(Property.queue_passive, false)
                    .with(Property.queue_nowait, false)
                    .with(Property.queue_durable, false)
                    .with(Property.queue_exclusive, true)
                    .with(Property.queue_auto_delete, true)
                    .with(Property.queue_arguments, Collections.emptyMap());
        } else {
            builder.with(Property.queue, properties.rpc_reply_queue)
                    .with(Property.qos, true)
                    .with(Property.qos_prefetch_size, 0)
                    .with(Property.qos_prefetch_count, 1)
                    .with(Property.qos_global, false);
        }
        return builder.build();
    }

    static class ReplyHandler implements MessageHandler {

        private final String correlationId;
        private final ReplyQueueMode mode;
        private final int maxForeignRedeliveries;
        private final Map<String, Integer> foreignSeen = new HashMap<>();

        byte[] response;

        ReplyHandler(String correlationId, ReplyQueueMode mode, int maxForeignRedeliveries) {
            this.correlationId = correlationId;
            this.mode = mode;
            this.maxForeignRedeliveries = maxForeignRedeliveries;
        }

        @Override
        public void handle(Message message, Resolver resolver) throws IOException {
            if (correlationId.equals(message.getCorrelationId())) {
                response = message.body;
                resolver.acknowledge(message);
                resolver.stopWhenProcessed();
                return;
            }
            if (mode == ReplyQueueMode.exclusive_per_call) {
                log.debugWithParams("Dropping stale rpc reply.",
                        "expected", correlationId,
                        "received", message.getCorrelationId());
                resolver.reject(message, false);
                return;
            }
            final String foreign = String.valueOf(message.getCorrelationId());
            final int seen = foreignSeen.merge(foreign, 1, Integer::sum);
            if (seen > maxForeignRedeliveries) {
                log.warnWithParams("Dropping rpc reply that no caller has claimed.",
                        "correlationId", foreign,
                        "timesSeen", seen,
                        "replyQueue", message.envelope.getRoutingKey());
                resolver.reject(message, false);
            } else {
                resolver.reject(message, true);
            }
        }
    }
}
