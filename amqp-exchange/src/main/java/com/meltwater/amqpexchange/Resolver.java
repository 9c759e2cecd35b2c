package com.meltwater.amqpexchange;

import java.io.IOException;

/**
 * Settles messages delivered to a {@link MessageHandler} and controls the consume loop.
 *
 * Each delivered message can be settled exactly once, either by {@link #acknowledge(Message)} or by
 * {@link #reject(Message, boolean)}.
 */
public interface Resolver {

    /**
     * Acknowledges the single message.
     *
     * @throws IllegalStateException if the message was already settled
     * @throws IllegalArgumentException if the message was not delivered by this consume loop
     */
    void acknowledge(Message message) throws IOException;

    /**
     * Rejects the single message. A message rejected without requeue is dead-lettered if the queue has a dead letter exchange
     * and dropped otherwise.
     *
     * @throws IllegalStateException if the message was already settled or if the loop consumes without acknowledgements
     * @throws IllegalArgumentException if the message was not delivered by this consume loop
     */
    void reject(Message message, boolean requeue) throws IOException;

    /**
     * Publishes a response to the reply-to queue of the original message (through the default exchange) carrying
     * the correlation id of the original. The original message is not settled by this call.
     *
     * @throws IllegalArgumentException if the original message has no reply-to
     */
    void reply(Message original, Message response) throws IOException;

    void reply(Message original, byte[] responseBody) throws IOException;

    void reply(Message original, String responseBody) throws IOException;

    /**
     * Stops the consume loop once the handler returns. Messages buffered but not yet handled are not processed.
     */
    void stopWhenProcessed();
}
