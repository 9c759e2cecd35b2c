package com.meltwater.amqpexchange.impl;

import com.meltwater.amqpexchange.AmqpProperties;
import com.meltwater.amqpexchange.ConnectionManager;
import com.meltwater.amqpexchange.ConnectionManagerFactory;
import com.meltwater.amqpexchange.util.Logger;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.impl.AMQConnection;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Opens one connection and one channel per instance using the rabbitmq java client.
 *
 * Automatic connection and topology recovery of the java client is switched off.
 */
public class DefaultConnectionManager implements ConnectionManager {

    private static final Logger log = new Logger(DefaultConnectionManager.class);

    private final AmqpProperties properties;
    private final Supplier<ConnectionFactory> connectionFactorySupplier;

    private Connection connection;
    private Channel channel;
    private DateTime connectTime;

    public DefaultConnectionManager(AmqpProperties properties) {
        this(properties, ConnectionFactory::new);
    }

    public DefaultConnectionManager(AmqpProperties properties, Supplier<ConnectionFactory> connectionFactorySupplier) {
        this.properties = properties;
        this.connectionFactorySupplier = connectionFactorySupplier;
    }

    /**
     * @return a factory creating managers that share the given source of {@link ConnectionFactory} instances
     */
    public static ConnectionManagerFactory factory(Supplier<ConnectionFactory> connectionFactorySupplier) {
        return properties -> new DefaultConnectionManager(properties, connectionFactorySupplier);
    }

    public static ConnectionManagerFactory factory() {
        return DefaultConnectionManager::new;
    }

    @Override
    public synchronized void connect() throws IOException, TimeoutException {
        if (isConnected()) {
            return;
        }
        connectTime = new DateTime(DateTimeZone.UTC);
        ConnectionFactory cf = createConnectionFactory();
        connection = cf.newConnection(properties.connection_name);
        try {
            channel = connection.createChannel();
        } catch (IOException | RuntimeException e) {
            closeConnection();
            throw e;
        }
        if (channel == null) {
            closeConnection();
            throw new IOException("No channel available on the connection (channel_max reached)");
        }
        log.infoWithParams("Successfully connected to broker.",
                "host", properties.host,
                "port", properties.port,
                "vhost", properties.vhost,
                "localPort", connection instanceof AMQConnection ? ((AMQConnection) connection).getLocalPort() : -1,
                "name", properties.connection_name,
                "connectTime", connectTime.toString(),
                "channelNr", channel.getChannelNumber());
    }

    @Override
    public synchronized boolean isConnected() {
        return connection != null && connection.isOpen() && channel != null && channel.isOpen();
    }

    @Override
    public synchronized Channel getChannel() {
        if (channel == null) {
            throw new IllegalStateException("Not connected. Call connect() first.");
        }
        return channel;
    }

    @Override
    public synchronized Connection getConnection() {
        if (connection == null) {
            throw new IllegalStateException("Not connected. Call connect() first.");
        }
        return connection;
    }

    @Override
    public synchronized void shutdown() {
        if (channel != null) {
            final boolean channelIsOpen = channel.isOpen();
            if (channelIsOpen) {
                try {
                    channel.close();
                } catch (Exception e) {
                    log.warnWithParams("Unexpected error when closing channel.", e,
                            "wasOpen", channelIsOpen,
                            "isOpen", channel.isOpen());
                }
            }
            channel = null;
        }
        if (connection != null) {
            final boolean connectionWasOpen = connection.isOpen();
            closeConnection();
            log.infoWithParams("Closed and disposed connection.",
                    "name", properties.connection_name,
                    "connectTime", connectTime,
                    "wasOpen", connectionWasOpen);
        }
    }

    private void closeConnection() {
        final boolean connectionIsOpen = connection.isOpen();
        if (connectionIsOpen) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warnWithParams("Unexpected error when closing connection.", e,
                        "wasOpen", connectionIsOpen,
                        "isOpen", connection.isOpen());
            }
        }
        connection = null;
    }

    ConnectionFactory createConnectionFactory() throws IOException {
        ConnectionFactory cf = connectionFactorySupplier.get();

        Map<String, Object> clientProperties = new HashMap<>();
        if (cf.getClientProperties() != null) {
            clientProperties.putAll(cf.getClientProperties());
        }
        clientProperties.putAll(properties.client_properties);
        clientProperties.put("app_id", properties.connection_name);
        clientProperties.put("connect_time", connectTime.toString());

        cf.setHost(properties.host);
        cf.setPort(properties.port);
        cf.setUsername(properties.username);
        cf.setPassword(properties.password);
        cf.setVirtualHost(properties.vhost);
        cf.setRequestedHeartbeat(properties.heartbeat_secs);
        cf.setConnectionTimeout(properties.connection_timeout_millis);
        cf.setHandshakeTimeout(properties.handshake_timeout_millis);
        cf.setShutdownTimeout(properties.shutdown_timeout_millis);
        cf.setChannelRpcTimeout(properties.channel_rpc_timeout_millis);
        cf.setRequestedFrameMax(properties.frame_max);
        cf.setClientProperties(clientProperties);
        cf.setAutomaticRecoveryEnabled(false);//reconnecting is up to the caller
        cf.setTopologyRecoveryEnabled(false);
        if (properties.tls_enabled) {
            cf.useSslProtocol(createSslContext());
            if (properties.tls_verify_hostname) {
                cf.enableHostnameVerification();
            }
        }
        return cf;
    }

    private SSLContext createSslContext() throws IOException {
        try {
            SSLContext sslContext = SSLContext.getInstance(properties.tls_protocol);
            if (properties.tls_truststore_path == null) {
                sslContext.init(null, null, null);
                return sslContext;
            }
            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            try (InputStream in = new FileInputStream(properties.tls_truststore_path)) {
                trustStore.load(in, properties.tls_truststore_password.toCharArray());
            }
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            sslContext.init(null, tmf.getTrustManagers(), null);
            return sslContext;
        } catch (GeneralSecurityException e) {
            throw new IOException("Could not set up TLS using protocol " + properties.tls_protocol, e);
        }
    }
}
