package com.meltwater.amqpexchange;

import com.rabbitmq.client.Channel;

/**
 * Creates the {@link Publisher} used on the channel of a {@link Request}.
 *
 * @see com.meltwater.amqpexchange.impl.SingleChannelPublisher
 */
public interface PublisherFactory {

    Publisher createPublisher(Channel channel, AmqpProperties properties);
}
