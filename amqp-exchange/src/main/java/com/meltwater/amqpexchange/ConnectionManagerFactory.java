package com.meltwater.amqpexchange;

/**
 * Creates a new {@link ConnectionManager} for each {@link Request}.
 *
 * @see com.meltwater.amqpexchange.impl.DefaultConnectionManager
 */
public interface ConnectionManagerFactory {

    ConnectionManager create(AmqpProperties properties);
}
