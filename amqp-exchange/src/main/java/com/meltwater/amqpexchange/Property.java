package com.meltwater.amqpexchange;

import com.google.common.collect.ImmutableList;
import com.rabbitmq.client.ConnectionFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All the configuration keys understood by {@link AmqpProperties}.
 *
 * The enum constant names are also the names used in the JSON representation of the settings
 * (see {@link AmqpProperties.Builder#Builder(String)}) and in {@link PropertyOverrides}.
 *
 * NOTE 0 means 'no limit' for all timeout and limit settings.
 */
public enum Property {

    // connection
    host(ValueType.string, "localhost"),
    port(ValueType.integer, 5672),
    username(ValueType.string, "guest"),
    password(ValueType.string, "guest"),
    vhost(ValueType.string, "/"),
    heartbeat_secs(ValueType.integer, 60),
    connection_timeout_millis(ValueType.integer, 3_000),
    handshake_timeout_millis(ValueType.integer, ConnectionFactory.DEFAULT_HANDSHAKE_TIMEOUT),
    shutdown_timeout_millis(ValueType.integer, ConnectionFactory.DEFAULT_SHUTDOWN_TIMEOUT),
    channel_rpc_timeout_millis(ValueType.integer, ConnectionFactory.DEFAULT_CHANNEL_RPC_TIMEOUT),
    frame_max(ValueType.integer, ConnectionFactory.DEFAULT_FRAME_MAX),
    connection_name(ValueType.string, "amqp-exchange"),
    client_properties(ValueType.map, Collections.emptyMap()),

    // tls
    tls_enabled(ValueType.bool, false),
    tls_protocol(ValueType.string, "TLSv1.2"),
    tls_truststore_path(ValueType.string, null),
    tls_truststore_password(ValueType.string, null),
    tls_verify_hostname(ValueType.bool, true),

    // exchange
    exchange(ValueType.string, "amq.topic"),
    exchange_type(ValueType.string, "topic"),
    exchange_passive(ValueType.bool, false),
    exchange_durable(ValueType.bool, true),
    exchange_auto_delete(ValueType.bool, false),
    exchange_internal(ValueType.bool, false),
    exchange_nowait(ValueType.bool, false),
    exchange_arguments(ValueType.map, Collections.emptyMap()),

    // queue
    queue(ValueType.string, ""),
    queue_force_declare(ValueType.bool, false),
    queue_passive(ValueType.bool, false),
    queue_durable(ValueType.bool, true),
    queue_exclusive(ValueType.bool, false),
    queue_auto_delete(ValueType.bool, false),
    queue_nowait(ValueType.bool, false),
    queue_arguments(ValueType.map, Collections.emptyMap()),

    routing(ValueType.list, ImmutableList.of()),

    // consumer
    consumer_tag(ValueType.string, ""),
    consumer_no_local(ValueType.bool, false),
    consumer_no_ack(ValueType.bool, false),
    consumer_exclusive(ValueType.bool, false),
    consumer_nowait(ValueType.bool, false),
    consumer_arguments(ValueType.map, Collections.emptyMap()),

    qos(ValueType.bool, false),
    qos_prefetch_size(ValueType.integer, 0),
    qos_prefetch_count(ValueType.integer, 1),
    qos_global(ValueType.bool, false),

    // consume loop
    timeout_secs(ValueType.integer, 0),
    max_duration_secs(ValueType.integer, 0),
    persistent(ValueType.bool, true),
    message_limit(ValueType.integer, 0),
    shutdown_signal(ValueType.string, null),

    // publishing
    mandatory(ValueType.bool, false),
    publish_timeout_secs(ValueType.integer, 30),
    content_type(ValueType.string, "text/plain"),

    // rpc
    rpc_reply_queue(ValueType.string, ""),
    rpc_timeout_secs(ValueType.integer, 30),
    rpc_max_foreign_redeliveries(ValueType.integer, 3);

    public final ValueType type;
    public final Object defaultValue;

    Property(ValueType type, Object defaultValue) {
        this.type = type;
        this.defaultValue = defaultValue;
    }

    /**
     * Looks up a property by its JSON name.
     *
     * @throws IllegalArgumentException if there is no property with the given name
     */
    public static Property fromKey(String key) {
        for (Property p : values()) {
            if (p.name().equals(key)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown property '" + key + "'");
    }

    /**
     * Converts a raw value (for example parsed from JSON) to the representation stored in {@link AmqpProperties}.
     *
     * @throws IllegalArgumentException if the value can not be used for this property
     */
    public Object coerce(Object value) {
        if (value == null) {
            if (type == ValueType.string) {
                return null;
            }
            throw new IllegalArgumentException("Property '" + name() + "' can not be null");
        }
        switch (type) {
            case string:
                if (value instanceof String) {
                    return value;
                }
                break;
            case integer:
                if (value instanceof Integer) {
                    return value;
                }
                if (value instanceof Number && ((Number) value).longValue() == ((Number) value).doubleValue()
                        && ((Number) value).longValue() <= Integer.MAX_VALUE
                        && ((Number) value).longValue() >= Integer.MIN_VALUE) {
                    return ((Number) value).intValue();
                }
                break;
            case bool:
                if (value instanceof Boolean) {
                    return value;
                }
                break;
            case map:
                if (value instanceof Map) {
                    Map<String, Object> copy = new LinkedHashMap<>();
                    for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                        if (!(e.getKey() instanceof String)) {
                            throw new IllegalArgumentException("Property '" + name() + "' only accepts string keys, got " + e.getKey());
                        }
                        copy.put((String) e.getKey(), e.getValue());
                    }
                    return Collections.unmodifiableMap(copy);
                }
                break;
            case list:
                if (value instanceof String) {
                    return ImmutableList.of((String) value);
                }
                if (value instanceof List) {
                    ImmutableList.Builder<String> builder = ImmutableList.builder();
                    for (Object o : (List<?>) value) {
                        if (!(o instanceof String)) {
                            throw new IllegalArgumentException("Property '" + name() + "' only accepts strings, got " + o);
                        }
                        builder.add((String) o);
                    }
                    return builder.build();
                }
                break;
        }
        throw new IllegalArgumentException("Property '" + name() + "' expects a value of type " + type
                + " but got " + value.getClass().getSimpleName());
    }

    public enum ValueType {
        string,
        integer,
        bool,
        map,
        list
    }
}
