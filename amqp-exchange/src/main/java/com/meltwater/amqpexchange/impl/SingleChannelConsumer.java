package com.meltwater.amqpexchange.impl;

import com.meltwater.amqpexchange.AmqpProperties;
import com.meltwater.amqpexchange.ConsumeResult;
import com.meltwater.amqpexchange.LoopState;
import com.meltwater.amqpexchange.Message;
import com.meltwater.amqpexchange.MessageHandler;
import com.meltwater.amqpexchange.MessageHandlerException;
import com.meltwater.amqpexchange.Publisher;
import com.meltwater.amqpexchange.QueueConsumer;
import com.meltwater.amqpexchange.QueueInfo;
import com.meltwater.amqpexchange.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.ConsumerCancelledException;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A consume loop using one {@link Channel} and one {@link Consumer}.
 *
 * The java client pushes deliveries to an {@link InternalConsumer} on its own dispatch thread. They are handed over
 * through a queue to the thread that called {@link #consume(QueueInfo, MessageHandler)}, where the handler is invoked.
 * Acknowledgements are therefore sent in handler order.
 *
 * When the loop ends the consumer is cancelled. Messages buffered by the prefetch but not handled stay unacknowledged
 * and are redelivered once the channel is closed.
 */
public class SingleChannelConsumer implements QueueConsumer {

    private static final Logger log = new Logger(SingleChannelConsumer.class);

    private final Channel channel;
    private final AmqpProperties properties;
    private final Publisher replyPublisher;

    public SingleChannelConsumer(Channel channel, AmqpProperties properties, Publisher replyPublisher) {
        this.channel = channel;
        this.properties = properties;
        this.replyPublisher = replyPublisher;
    }

    @Override
    public ConsumeResult consume(QueueInfo queue, MessageHandler handler) throws IOException {
        if (queue == null) {
            throw new IllegalStateException("No queue has been declared to consume from.");
        }
        if (!properties.persistent && queue.messageCount == 0) {
            log.infoWithParams("Queue is empty. Nothing to consume.", "queue", queue.name);
            return new ConsumeResult(LoopState.drained, 0);
        }
        if (properties.qos) {
            channel.basicQos(properties.qos_prefetch_size, properties.qos_prefetch_count, properties.qos_global);
        }
        if (properties.consumer_nowait) {
            log.warnWithParams("consumer_nowait is not supported, the consumer waits for the broker to register it.",
                    "queue", queue.name);
        }

        final LoopResolver resolver = new LoopResolver(channel, replyPublisher, properties.consumer_no_ack, properties.shutdown_signal);
        final InternalConsumer consumer = new InternalConsumer(queue.name);
        final String consumerTag = channel.basicConsume(queue.name,
                properties.consumer_no_ack,
                properties.consumer_tag,
                properties.consumer_no_local,
                properties.consumer_exclusive,
                properties.consumer_arguments,
                consumer);
        log.infoWithParams("Starting consume loop.",
                "queue", queue.name,
                "consumerTag", consumerTag,
                "readyMessages", queue.messageCount,
                "persistent", properties.persistent,
                "messageLimit", properties.message_limit,
                "timeoutSecs", properties.timeout_secs,
                "maxDurationSecs", properties.max_duration_secs);

        long processed = 0;
        LoopState state = LoopState.running;
        try {
            // elapsed times only, nanoTime has no fixed origin
            final long startedAt = System.nanoTime();
            final long maxDurationNanos = properties.max_duration_secs > 0
                    ? TimeUnit.SECONDS.toNanos(properties.max_duration_secs)
                    : Long.MAX_VALUE;
            final long idleTimeoutNanos = TimeUnit.SECONDS.toNanos(properties.timeout_secs);
            long lastActivity = startedAt;

            while (state == LoopState.running) {
                final long now = System.nanoTime();
                long waitNanos = maxDurationNanos - (now - startedAt);
                if (idleTimeoutNanos > 0) {
                    waitNanos = Math.min(waitNanos, idleTimeoutNanos - (now - lastActivity));
                }
                if (waitNanos <= 0) {
                    state = LoopState.timed_out;
                    break;
                }
                final Delivery delivery = consumer.deliveries.poll(waitNanos, TimeUnit.NANOSECONDS);
                if (delivery == null) {
                    continue;
                }
                if (delivery.shutdownSignal != null) {
                    throw delivery.shutdownSignal;
                }
                if (delivery.cancelled) {
                    throw new ConsumerCancelledException();
                }
                resolver.delivered(delivery.message);
                invoke(handler, delivery.message, resolver);
                processed++;
                lastActivity = System.nanoTime();

                if (resolver.isStopRequested()) {
                    state = LoopState.stopped_by_signal;
                } else if (properties.message_limit > 0 && processed >= properties.message_limit) {
                    state = LoopState.stopped_by_limit;
                } else if (!properties.persistent && processed >= queue.messageCount) {
                    state = LoopState.drained;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for messages on queue " + queue.name, e);
        } finally {
            cancel(consumerTag);
        }
        log.infoWithParams("Consume loop ended.",
                "queue", queue.name,
                "consumerTag", consumerTag,
                "state", state,
                "processed", processed,
                "unsettled", resolver.pendingCount());
        return new ConsumeResult(state, processed);
    }

    private void invoke(MessageHandler handler, Message message, LoopResolver resolver) {
        try {
            handler.handle(message, resolver);
        } catch (RuntimeException e) {
            log.errorWithParams("Message handler failed. Stopping the consumer.", e,
                    "deliveryTag", message.getDeliveryTag(),
                    "messageId", message.properties.getMessageId());
            throw e;
        } catch (Exception e) {
            log.errorWithParams("Message handler failed. Stopping the consumer.", e,
                    "deliveryTag", message.getDeliveryTag(),
                    "messageId", message.properties.getMessageId());
            throw new MessageHandlerException(e);
        }
    }

    private void cancel(String consumerTag) {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.basicCancel(consumerTag);
        } catch (Exception e) {
            log.warnWithParams("Unexpected error when cancelling the consumer.", e, "consumerTag", consumerTag);
        }
    }

    private static class Delivery {
        final Message message;
        final ShutdownSignalException shutdownSignal;
        final boolean cancelled;

        Delivery(Message message, ShutdownSignalException shutdownSignal, boolean cancelled) {
            this.message = message;
            this.shutdownSignal = shutdownSignal;
            this.cancelled = cancelled;
        }
    }

    static class InternalConsumer implements Consumer {

        final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();
        private final String queue;

        InternalConsumer(String queue) {
            this.queue = queue;
        }

        @Override
        public void handleConsumeOk(String consumerTag) {
            log.infoWithParams("Consumer registered and ready to receive messages.",
                    "queue", queue,
                    "consumerTag", consumerTag);
        }

        @Override
        public void handleCancelOk(String consumerTag) {
            log.infoWithParams("Consumer successfully stopped. It will not receive any more messages.",
                    "queue", queue,
                    "consumerTag", consumerTag);
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warnWithParams("Consumer cancelled by the broker. It will not receive any more messages.",
                    "queue", queue,
                    "consumerTag", consumerTag);
            deliveries.add(new Delivery(null, null, true));
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            if (!sig.isInitiatedByApplication()) {
                log.errorWithParams("The channel was unexpectedly closed.", sig,
                        "queue", queue,
                        "consumerTag", consumerTag);
            }
            deliveries.add(new Delivery(null, sig, false));
        }

        @Override
        public void handleRecoverOk(String consumerTag) {
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            log.traceWithParams("Consumer received message",
                    "consumerTag", consumerTag,
                    "deliveryTag", envelope.getDeliveryTag(),
                    "redeliver", envelope.isRedeliver(),
                    "messageId", properties.getMessageId());
            deliveries.add(new Delivery(new Message(body, properties, envelope, consumerTag), null, false));
        }
    }
}
