package com.meltwater.amqpexchange;

import com.meltwater.amqpexchange.util.Logger;
import com.rabbitmq.client.Channel;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * One unit of work against the broker: a connection, a channel and the topology declared on it.
 *
 * <pre>
 * try (Request request = new Request(properties, connectionManagerFactory.create(properties))) {
 *     request.setup();
 *     ... use request.getChannel() ...
 * }
 * </pre>
 *
 * A request is not thread safe and its channel must only be used by the thread that owns the request.
 */
public class Request implements AutoCloseable {

    private static final Logger log = new Logger(Request.class);

    private final AmqpProperties properties;
    private final ConnectionManager connectionManager;

    private RequestState state = RequestState.unconnected;
    private QueueInfo queueInfo;

    public Request(AmqpProperties properties, ConnectionManager connectionManager) {
        this.properties = properties;
        this.connectionManager = connectionManager;
    }

    public synchronized void connect() throws IOException, TimeoutException {
        checkNotClosed();
        if (state != RequestState.unconnected) {
            return;
        }
        connectionManager.connect();
        state = RequestState.connected;
    }

    /**
     * Declares the exchange, then the queue and its bindings if a queue is configured.
     *
     * @return the declared queue or null if no queue was declared
     */
    public synchronized QueueInfo declare() throws IOException {
        checkNotClosed();
        if (state == RequestState.unconnected) {
            throw new IllegalStateException("The request must be connected before declaring the topology.");
        }
        if (state == RequestState.ready) {
            return queueInfo;
        }
        TopologyDeclarator declarator = new TopologyDeclarator(connectionManager.getChannel(), properties);
        declarator.declareExchange();
        state = RequestState.declared;
        if (declarator.shouldDeclareQueue()) {
            queueInfo = declarator.declareQueue();
            declarator.bindQueue(queueInfo.name);
        }
        state = RequestState.ready;
        log.infoWithParams("Request ready.",
                "exchange", properties.exchange,
                "exchangeType", properties.exchange_type,
                "queue", queueInfo == null ? null : queueInfo.name,
                "messageCount", queueInfo == null ? null : queueInfo.messageCount,
                "routing", properties.routing);
        return queueInfo;
    }

    /**
     * Connects and declares the topology.
     */
    public QueueInfo setup() throws IOException, TimeoutException {
        connect();
        return declare();
    }

    public synchronized Channel getChannel() {
        checkNotClosed();
        return connectionManager.getChannel();
    }

    public AmqpProperties getProperties() {
        return properties;
    }

    /**
     * @return the queue declared by {@link #declare()} or null if no queue has been declared
     */
    public synchronized QueueInfo getQueueInfo() {
        return queueInfo;
    }

    public synchronized RequestState getState() {
        return state;
    }

    /**
     * Releases the channel and the connection. Calling it more than once has no effect.
     */
    public synchronized void shutdown() {
        if (state == RequestState.closed) {
            return;
        }
        state = RequestState.closed;
        connectionManager.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    private void checkNotClosed() {
        if (state == RequestState.closed) {
            throw new IllegalStateException("The request is closed.");
        }
    }
}
