package com.meltwater.amqpexchange.impl;

import com.meltwater.amqpexchange.AmqpProperties;
import com.meltwater.amqpexchange.Message;
import com.meltwater.amqpexchange.Publisher;
import com.meltwater.amqpexchange.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.ReturnListener;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A publisher using a single {@link Channel}.
 *
 * Mandatory messages are published with publisher confirms. The channel is switched to confirm mode the first time
 * a mandatory message is published and then each mandatory publish waits for the broker confirm before returning.
 * A basic.return or basic.nack received while waiting marks the publish as failed.
 */
public class SingleChannelPublisher implements Publisher {

    private static final Logger log = new Logger(SingleChannelPublisher.class);

    public static final int DEFAULT_PUBLISH_TIMEOUT_SECS = 30;

    private final Channel channel;
    private final String exchange;
    private final long publishTimeoutMillis;

    private final List<StagedMessage> batch = new ArrayList<>();

    private final AtomicBoolean returned = new AtomicBoolean(false);
    private final AtomicBoolean nacked = new AtomicBoolean(false);
    private boolean confirmMode = false;

    public SingleChannelPublisher(Channel channel, AmqpProperties properties) {
        this.channel = channel;
        this.exchange = properties.exchange;
        final int timeoutSecs = properties.publish_timeout_secs > 0 ? properties.publish_timeout_secs : DEFAULT_PUBLISH_TIMEOUT_SECS;
        this.publishTimeoutMillis = TimeUnit.SECONDS.toMillis(timeoutSecs);
    }

    @Override
    public boolean publish(String routingKey, Message message, boolean mandatory) throws IOException {
        return publish(exchange, routingKey, message, mandatory);
    }

    @Override
    public synchronized boolean publish(String exchange, String routingKey, Message message, boolean mandatory) throws IOException {
        if (!mandatory) {
            channel.basicPublish(exchange, routingKey, false, message.properties, message.body);
            log.traceWithParams("Published message.",
                    "exchange", exchange,
                    "routingKey", routingKey,
                    "messageId", message.properties.getMessageId());
            return true;
        }
        enableConfirmMode();
        returned.set(false);
        nacked.set(false);
        channel.basicPublish(exchange, routingKey, true, message.properties, message.body);
        boolean confirmed;
        try {
            confirmed = channel.waitForConfirms(publishTimeoutMillis);
        } catch (TimeoutException e) {
            log.warnWithParams("Message was not confirmed by the broker in time.",
                    "exchange", exchange,
                    "routingKey", routingKey,
                    "publishTimeoutMillis", publishTimeoutMillis);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warnWithParams("Interrupted while waiting for the broker to confirm a message.",
                    "exchange", exchange,
                    "routingKey", routingKey);
            return false;
        }
        final boolean success = confirmed && !returned.get() && !nacked.get();
        if (!success) {
            log.warnWithParams("Mandatory message was not accepted by the broker.",
                    "exchange", exchange,
                    "routingKey", routingKey,
                    "returned", returned.get(),
                    "nacked", nacked.get() || !confirmed);
        }
        return success;
    }

    @Override
    public synchronized void batchBasicPublish(String routingKey, Message message) {
        batch.add(new StagedMessage(routingKey, message));
    }

    /**
     * Sends the staged messages one by one. If sending fails, the messages already sent are removed from the batch
     * and the rest stays staged.
     */
    @Override
    public synchronized int batchPublish() throws IOException {
        int sent = 0;
        try {
            for (StagedMessage staged : batch) {
                channel.basicPublish(exchange, staged.routingKey, false, staged.message.properties, staged.message.body);
                sent++;
            }
        } finally {
            batch.subList(0, sent).clear();
        }
        log.debugWithParams("Published batch.",
                "exchange", exchange,
                "messages", sent);
        return sent;
    }

    @Override
    public synchronized int pendingBatchSize() {
        return batch.size();
    }

    private void enableConfirmMode() throws IOException {
        if (confirmMode) {
            return;
        }
        channel.confirmSelect();
        channel.addReturnListener(new InternalReturnListener());
        channel.addConfirmListener(new InternalConfirmListener());
        confirmMode = true;
    }

    private class InternalReturnListener implements ReturnListener {
        @Override
        public void handleReturn(int replyCode, String replyText, String exchange, String routingKey,
                                 AMQP.BasicProperties properties, byte[] body) {
            returned.set(true);
            log.warnWithParams("Message returned by the broker.",
                    "replyCode", replyCode,
                    "replyText", replyText,
                    "exchange", exchange,
                    "routingKey", routingKey);
        }
    }

    private class InternalConfirmListener implements ConfirmListener {
        @Override
        public void handleAck(long deliveryTag, boolean multiple) {
            log.traceWithParams("Message confirmed.", "deliveryTag", deliveryTag, "multiple", multiple);
        }

        @Override
        public void handleNack(long deliveryTag, boolean multiple) {
            nacked.set(true);
            log.warnWithParams("Message nacked by the broker.", "deliveryTag", deliveryTag, "multiple", multiple);
        }
    }

    private static class StagedMessage {
        final String routingKey;
        final Message message;

        StagedMessage(String routingKey, Message message) {
            this.routingKey = routingKey;
            this.message = message;
        }
    }
}
