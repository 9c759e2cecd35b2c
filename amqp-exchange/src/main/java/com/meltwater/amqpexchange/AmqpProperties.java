package com.meltwater.amqpexchange;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meltwater.amqpexchange.util.Logger;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The effective configuration of one request against the broker: connection settings, the exchange and queue
 * topology to declare, consumer and publisher behaviour.
 *
 * Instances are immutable and can be shared freely. They are built with {@link AmqpProperties.Builder}, either
 * programmatically with the withXX methods or from a JSON formatted String (see {@link Builder#Builder(String)}).
 * The JSON parameter names are the names of the {@link Property} constants which also directly correspond
 * to the names of the fields in this class.
 *
 * Per call variations are not applied here but through {@link PropertyResolver#resolve(AmqpProperties, PropertyOverrides)}
 * which also validates the result.
 *
 * The {@link #toString()} method shows the JSON representation of this class (with the password masked).
 */
public class AmqpProperties {

    private final static Logger log = new Logger(AmqpProperties.class);
    private final static ObjectMapper mapper = new ObjectMapper();

    static {
        mapper.configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true);
        mapper.configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true);
        mapper.configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);
    }

    public final String host;
    public final int port;
    public final String username;
    public final String password;
    public final String vhost;
    public final int heartbeat_secs;
    public final int connection_timeout_millis;
    public final int handshake_timeout_millis;
    public final int shutdown_timeout_millis;
    public final int channel_rpc_timeout_millis;
    public final int frame_max;
    public final String connection_name;
    public final Map<String, Object> client_properties;

    public final boolean tls_enabled;
    public final String tls_protocol;
    public final String tls_truststore_path;
    public final String tls_truststore_password;
    public final boolean tls_verify_hostname;

    public final String exchange;
    public final String exchange_type;
    public final boolean exchange_passive;
    public final boolean exchange_durable;
    public final boolean exchange_auto_delete;
    public final boolean exchange_internal;
    public final boolean exchange_nowait;
    public final Map<String, Object> exchange_arguments;

    public final String queue;
    public final boolean queue_force_declare;
    public final boolean queue_passive;
    public final boolean queue_durable;
    public final boolean queue_exclusive;
    public final boolean queue_auto_delete;
    public final boolean queue_nowait;
    public final Map<String, Object> queue_arguments;

    public final List<String> routing;

    public final String consumer_tag;
    public final boolean consumer_no_local;
    public final boolean consumer_no_ack;
    public final boolean consumer_exclusive;
    public final boolean consumer_nowait;
    public final Map<String, Object> consumer_arguments;

    public final boolean qos;
    public final int qos_prefetch_size;
    public final int qos_prefetch_count;
    public final boolean qos_global;

    //NOTE 0 means no limit
    public final int timeout_secs;
    public final int max_duration_secs;
    public final boolean persistent;
    public final int message_limit;
    public final String shutdown_signal;

    public final boolean mandatory;
    public final int publish_timeout_secs;
    public final String content_type;

    public final String rpc_reply_queue;
    public final int rpc_timeout_secs;
    public final int rpc_max_foreign_redeliveries;

    private final Map<Property, Object> values;

    @SuppressWarnings("unchecked")
    private AmqpProperties(EnumMap<Property, Object> values) {
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));

        host = (String) values.get(Property.host);
        port = (int) values.get(Property.port);
        username = (String) values.get(Property.username);
        password = (String) values.get(Property.password);
        vhost = (String) values.get(Property.vhost);
        heartbeat_secs = (int) values.get(Property.heartbeat_secs);
        connection_timeout_millis = (int) values.get(Property.connection_timeout_millis);
        handshake_timeout_millis = (int) values.get(Property.handshake_timeout_millis);
        shutdown_timeout_millis = (int) values.get(Property.shutdown_timeout_millis);
        channel_rpc_timeout_millis = (int) values.get(Property.channel_rpc_timeout_millis);
        frame_max = (int) values.get(Property.frame_max);
        connection_name = (String) values.get(Property.connection_name);
        client_properties = (Map<String, Object>) values.get(Property.client_properties);

        tls_enabled = (boolean) values.get(Property.tls_enabled);
        tls_protocol = (String) values.get(Property.tls_protocol);
        tls_truststore_path = (String) values.get(Property.tls_truststore_path);
        tls_truststore_password = (String) values.get(Property.tls_truststore_password);
        tls_verify_hostname = (boolean) values.get(Property.tls_verify_hostname);

        exchange = (String) values.get(Property.exchange);
        exchange_type = (String) values.get(Property.exchange_type);
        exchange_passive = (boolean) values.get(Property.exchange_passive);
        exchange_durable = (boolean) values.get(Property.exchange_durable);
        exchange_auto_delete = (boolean) values.get(Property.exchange_auto_delete);
        exchange_internal = (boolean) values.get(Property.exchange_internal);
        exchange_nowait = (boolean) values.get(Property.exchange_nowait);
        exchange_arguments = (Map<String, Object>) values.get(Property.exchange_arguments);

        queue = (String) values.get(Property.queue);
        queue_force_declare = (boolean) values.get(Property.queue_force_declare);
        queue_passive = (boolean) values.get(Property.queue_passive);
        queue_durable = (boolean) values.get(Property.queue_durable);
        queue_exclusive = (boolean) values.get(Property.queue_exclusive);
        queue_auto_delete = (boolean) values.get(Property.queue_auto_delete);
        queue_nowait = (boolean) values.get(Property.queue_nowait);
        queue_arguments = (Map<String, Object>) values.get(Property.queue_arguments);

        routing = (List<String>) values.get(Property.routing);

        consumer_tag = (String) values.get(Property.consumer_tag);
        consumer_no_local = (boolean) values.get(Property.consumer_no_local);
        consumer_no_ack = (boolean) values.get(Property.consumer_no_ack);
        consumer_exclusive = (boolean) values.get(Property.consumer_exclusive);
        consumer_nowait = (boolean) values.get(Property.consumer_nowait);
        consumer_arguments = (Map<String, Object>) values.get(Property.consumer_arguments);

        qos = (boolean) values.get(Property.qos);
        qos_prefetch_size = (int) values.get(Property.qos_prefetch_size);
        qos_prefetch_count = (int) values.get(Property.qos_prefetch_count);
        qos_global = (boolean) values.get(Property.qos_global);

        timeout_secs = (int) values.get(Property.timeout_secs);
        max_duration_secs = (int) values.get(Property.max_duration_secs);
        persistent = (boolean) values.get(Property.persistent);
        message_limit = (int) values.get(Property.message_limit);
        shutdown_signal = (String) values.get(Property.shutdown_signal);

        mandatory = (boolean) values.get(Property.mandatory);
        publish_timeout_secs = (int) values.get(Property.publish_timeout_secs);
        content_type = (String) values.get(Property.content_type);

        rpc_reply_queue = (String) values.get(Property.rpc_reply_queue);
        rpc_timeout_secs = (int) values.get(Property.rpc_timeout_secs);
        rpc_max_foreign_redeliveries = (int) values.get(Property.rpc_max_foreign_redeliveries);
    }

    public Object get(Property property) {
        return values.get(property);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((AmqpProperties) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        Map<String, Object> printable = new LinkedHashMap<>();
        for (Map.Entry<Property, Object> e : values.entrySet()) {
            printable.put(e.getKey().name(), e.getValue());
        }
        printable.put(Property.password.name(), "*****");
        if (tls_truststore_password != null) {
            printable.put(Property.tls_truststore_password.name(), "*****");
        }
        try {
            return mapper.writeValueAsString(printable);
        } catch (IOException e) {
            return e.toString();
        }
    }

    public static class Builder {

        private final EnumMap<Property, Object> values = new EnumMap<>(Property.class);

        public Builder() {
            for (Property property : Property.values()) {
                values.put(property, property.defaultValue);
            }
        }

        /**
         * Creates a builder with the values supplied in the JSON formatted string filled in.
         * The surrounding curly braces and the quotes around the field names can be left out, strings can use single quotes.
         *
         * @throws IllegalArgumentException if the string can not be parsed or contains unknown keys
         */
        @SuppressWarnings("unchecked")
        public Builder(String settingsJSONString) {
            this();
            if (!settingsJSONString.trim().startsWith("{")) {
                settingsJSONString = "{" + settingsJSONString + "}";
            }
            Map<String, Object> map;
            try {
                map = mapper.readValue(settingsJSONString, Map.class);
            } catch (Exception e) {
                log.errorWithParams("Could not parse settings string.", e);
                throw new IllegalArgumentException(e);
            }
            for (Map.Entry<String, Object> entry : map.entrySet()) {
                with(Property.fromKey(entry.getKey()), entry.getValue());
            }
        }

        public Builder with(Property property, Object value) {
            values.put(property, property.coerce(value));
            return this;
        }

        public Builder withHost(String host) {
            return with(Property.host, host);
        }

        public Builder withPort(int port) {
            return with(Property.port, port);
        }

        public Builder withCredentials(String username, String password) {
            return with(Property.username, username).with(Property.password, password);
        }

        public Builder withVhost(String vhost) {
            return with(Property.vhost, vhost);
        }

        public Builder withConnectionName(String connectionName) {
            return with(Property.connection_name, connectionName);
        }

        public Builder withExchange(String exchange, String type) {
            return with(Property.exchange, exchange).with(Property.exchange_type, type);
        }

        public Builder withQueue(String queue) {
            return with(Property.queue, queue);
        }

        public Builder withQueueArguments(Map<String, Object> arguments) {
            return with(Property.queue_arguments, arguments);
        }

        public Builder withRoutingKeys(String... routingKeys) {
            return with(Property.routing, Arrays.asList(routingKeys));
        }

        public Builder withPersistent(boolean persistent) {
            return with(Property.persistent, persistent);
        }

        public Builder withMessageLimit(int messageLimit) {
            return with(Property.message_limit, messageLimit);
        }

        public Builder withTimeoutSecs(int timeoutSecs) {
            return with(Property.timeout_secs, timeoutSecs);
        }

        public Builder withPublishTimeoutSecs(int publishTimeoutSecs) {
            return with(Property.publish_timeout_secs, publishTimeoutSecs);
        }

        public AmqpProperties build() {
            return new AmqpProperties(values);
        }
    }
}
