package com.meltwater.amqpexchange;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Owns exactly one broker {@link Connection} and one {@link Channel} on it.
 *
 * A connection manager is created for, and exclusively used by, one {@link Request}.
 * It never reconnects by itself, reconnection policy belongs to the caller.
 */
public interface ConnectionManager {

    /**
     * Opens the connection and the channel. Calling this method on a connected manager does nothing.
     */
    void connect() throws IOException, TimeoutException;

    boolean isConnected();

    /**
     * @throws IllegalStateException if {@link #connect()} has not been called successfully
     */
    Channel getChannel();

    /**
     * @throws IllegalStateException if {@link #connect()} has not been called successfully
     */
    Connection getConnection();

    /**
     * Closes the channel and then the connection. Safe to call several times and when either of them is already closed.
     */
    void shutdown();
}
