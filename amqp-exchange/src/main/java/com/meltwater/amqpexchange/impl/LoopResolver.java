package com.meltwater.amqpexchange.impl;

import com.google.common.base.Strings;
import com.meltwater.amqpexchange.Message;
import com.meltwater.amqpexchange.Publisher;
import com.meltwater.amqpexchange.Resolver;
import com.meltwater.amqpexchange.util.Logger;
import com.rabbitmq.client.Channel;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * The {@link Resolver} of one consume loop.
 *
 * Delivery tags grow monotonically on a channel, so a tag at or below the highest delivered tag that is no longer
 * pending has already been settled.
 */
public class LoopResolver implements Resolver {

    private static final Logger log = new Logger(LoopResolver.class);

    private final Channel channel;
    private final Publisher replyPublisher;
    private final boolean noAck;
    private final byte[] shutdownSignal;

    private final Set<Long> pending = new HashSet<>();
    private long highestDeliveredTag = 0;
    private String consumerTag;

    private boolean stopRequested = false;

    public LoopResolver(Channel channel, Publisher replyPublisher, boolean noAck, String shutdownSignal) {
        this.channel = channel;
        this.replyPublisher = replyPublisher;
        this.noAck = noAck;
        this.shutdownSignal = shutdownSignal == null ? null : shutdownSignal.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Registers a message handed to the handler by the loop.
     */
    void delivered(Message message) {
        final long tag = message.getDeliveryTag();
        if (consumerTag == null) {
            consumerTag = message.consumerTag;
        }
        pending.add(tag);
        highestDeliveredTag = Math.max(highestDeliveredTag, tag);
    }

    @Override
    public void acknowledge(Message message) throws IOException {
        final long tag = checkPending(message);
        if (!noAck) {
            channel.basicAck(tag, false);
        }
        pending.remove(tag);
        log.traceWithParams("Acknowledged message.", "deliveryTag", tag);
        if (shutdownSignal != null && Arrays.equals(shutdownSignal, message.body)) {
            log.infoWithParams("Shutdown signal received. Stopping the consumer.", "consumerTag", consumerTag);
            stopRequested = true;
        }
    }

    @Override
    public void reject(Message message, boolean requeue) throws IOException {
        if (noAck) {
            throw new IllegalStateException("Messages consumed without acknowledgements can not be rejected.");
        }
        final long tag = checkPending(message);
        channel.basicReject(tag, requeue);
        pending.remove(tag);
        log.traceWithParams("Rejected message.", "deliveryTag", tag, "requeue", requeue);
    }

    @Override
    public void reply(Message original, Message response) throws IOException {
        final String replyTo = original.getReplyTo();
        if (Strings.isNullOrEmpty(replyTo)) {
            throw new IllegalArgumentException("Can not reply to a message without reply_to.");
        }
        Message reply = response.toBuilder()
                .withCorrelationId(original.getCorrelationId())
                .build();
        replyPublisher.publish("", replyTo, reply, false);
        log.debugWithParams("Replied to message.",
                "replyTo", replyTo,
                "correlationId", original.getCorrelationId());
    }

    @Override
    public void reply(Message original, byte[] responseBody) throws IOException {
        reply(original, Message.builder(responseBody).build());
    }

    @Override
    public void reply(Message original, String responseBody) throws IOException {
        reply(original, Message.builder(responseBody).build());
    }

    @Override
    public void stopWhenProcessed() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public int pendingCount() {
        return pending.size();
    }

    private long checkPending(Message message) {
        if (!message.isDelivered()) {
            throw new IllegalArgumentException("The message was not delivered by the broker.");
        }
        if (consumerTag != null && message.consumerTag != null && !consumerTag.equals(message.consumerTag)) {
            throw new IllegalArgumentException("The message was delivered to another consumer: " + message.consumerTag);
        }
        final long tag = message.getDeliveryTag();
        if (pending.contains(tag)) {
            return tag;
        }
        if (tag > 0 && tag <= highestDeliveredTag) {
            throw new IllegalStateException("The message with delivery tag " + tag + " has already been acknowledged or rejected.");
        }
        throw new IllegalArgumentException("The message with delivery tag " + tag + " was not delivered by this consumer.");
    }
}
