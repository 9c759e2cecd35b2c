package com.meltwater.amqpexchange;

import com.rabbitmq.client.Channel;

/**
 * Creates the {@link QueueConsumer} used on the channel of a {@link Request}.
 *
 * @see com.meltwater.amqpexchange.impl.SingleChannelConsumer
 */
public interface ConsumerFactory {

    /**
     * @param replyPublisher publisher used by {@link Resolver#reply(Message, Message)}
     */
    QueueConsumer createConsumer(Channel channel, AmqpProperties properties, Publisher replyPublisher);
}
