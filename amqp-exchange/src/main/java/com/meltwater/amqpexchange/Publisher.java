package com.meltwater.amqpexchange;

import java.io.IOException;

/**
 * Publishes messages on the channel of one {@link Request}.
 *
 * A publisher is used by one thread at the time, like the channel it wraps.
 */
public interface Publisher {

    /**
     * Publishes the message to the configured exchange.
     *
     * When {@code mandatory} is true the channel is put in confirm mode and the call blocks until the broker confirms
     * the message (or the publish timeout expires).
     *
     * @return false if the broker returned the message as unroutable, nacked it or did not confirm it in time.
     *         Always true for non mandatory publishing, which means that the message was handed to the broker
     *         but that its delivery is not confirmed.
     */
    boolean publish(String routingKey, Message message, boolean mandatory) throws IOException;

    /**
     * Same as {@link #publish(String, Message, boolean)} but to an explicit exchange. The empty string is the default exchange.
     */
    boolean publish(String exchange, String routingKey, Message message, boolean mandatory) throws IOException;

    /**
     * Stages a message to be sent by the next call to {@link #batchPublish()}. Nothing is sent to the broker.
     */
    void batchBasicPublish(String routingKey, Message message);

    /**
     * Sends all staged messages to the configured exchange, in the order they were staged.
     *
     * @return the number of messages sent
     */
    int batchPublish() throws IOException;

    int pendingBatchSize();
}
