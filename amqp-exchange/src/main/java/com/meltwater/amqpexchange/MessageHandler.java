package com.meltwater.amqpexchange;

/**
 * Processes one delivered message and decides its fate through the {@link Resolver}.
 *
 * Called on the thread that runs the consume loop, one message at a time and in delivery order.
 * A message that is neither acknowledged nor rejected stays unacknowledged and is redelivered by the broker
 * once the channel is closed.
 */
public interface MessageHandler {

    /**
     * @throws Exception to abort the consume loop. The exception is propagated to the caller of the loop.
     */
    void handle(Message message, Resolver resolver) throws Exception;
}
