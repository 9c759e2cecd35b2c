package com.meltwater.amqpexchange;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns a base profile and per call overrides into a validated {@link AmqpProperties}.
 *
 * Overrides are always applied on the base that is passed in, so values from one call can never leak into the next.
 * All problems found in the result are reported together in one {@link ConfigurationException}.
 */
public class PropertyResolver {

    public static final Set<String> EXCHANGE_TYPES = ImmutableSet.of("topic", "direct", "fanout", "headers");
    public static final Set<String> QUEUE_TYPES = ImmutableSet.of("classic", "quorum", "stream");

    public static final String PLUGIN_EXCHANGE_TYPE_PREFIX = "x-";
    public static final String QUEUE_TYPE_ARGUMENT = "x-queue-type";
    public static final String MAX_PRIORITY_ARGUMENT = "x-max-priority";

    public AmqpProperties resolve(AmqpProperties base, PropertyOverrides overrides) {
        assert base != null;
        AmqpProperties.Builder builder = base.toBuilder();
        if (overrides != null) {
            overrides.applyTo(builder);
        }
        AmqpProperties resolved = builder.build();
        validate(resolved);
        return resolved;
    }

    /**
     * @throws ConfigurationException listing every violation found
     */
    public void validate(AmqpProperties properties) {
        List<String> violations = new ArrayList<>();

        if (Strings.isNullOrEmpty(properties.exchange)) {
            violations.add("exchange must not be empty");
        }
        if (!isValidExchangeType(properties.exchange_type)) {
            violations.add("Invalid exchange type '" + properties.exchange_type + "', expected one of "
                    + EXCHANGE_TYPES + " or a plugin type starting with '" + PLUGIN_EXCHANGE_TYPE_PREFIX + "'");
        }

        Object queueType = properties.queue_arguments.get(QUEUE_TYPE_ARGUMENT);
        if (queueType != null) {
            if (!QUEUE_TYPES.contains(queueType.toString())) {
                violations.add("Invalid " + QUEUE_TYPE_ARGUMENT + " '" + queueType + "', expected one of " + QUEUE_TYPES);
            } else if (!"classic".equals(queueType)) {
                if (properties.queue_exclusive) {
                    violations.add(QUEUE_TYPE_ARGUMENT + "=" + queueType + " conflicts with queue_exclusive=true");
                }
                if (properties.queue_auto_delete) {
                    violations.add(QUEUE_TYPE_ARGUMENT + "=" + queueType + " conflicts with queue_auto_delete=true");
                }
                if (!properties.queue_durable) {
                    violations.add(QUEUE_TYPE_ARGUMENT + "=" + queueType + " conflicts with queue_durable=false");
                }
            }
        }
        Object maxPriority = properties.queue_arguments.get(MAX_PRIORITY_ARGUMENT);
        if (maxPriority != null && !(maxPriority instanceof Number
                && ((Number) maxPriority).intValue() >= 1 && ((Number) maxPriority).intValue() <= 255)) {
            violations.add(MAX_PRIORITY_ARGUMENT + " must be a number between 1 and 255, was " + maxPriority);
        }

        if (properties.queue_nowait && Strings.isNullOrEmpty(properties.queue)) {
            violations.add("queue_nowait=true requires a queue name, a server named queue can not be declared without waiting");
        }

        checkRange(violations, Property.port, properties.port, 1, 65535);
        checkRange(violations, Property.qos_prefetch_count, properties.qos_prefetch_count, 0, 65535);
        checkRange(violations, Property.qos_prefetch_size, properties.qos_prefetch_size, 0, Integer.MAX_VALUE);
        checkRange(violations, Property.message_limit, properties.message_limit, 0, Integer.MAX_VALUE);
        checkRange(violations, Property.timeout_secs, properties.timeout_secs, 0, Integer.MAX_VALUE);
        checkRange(violations, Property.max_duration_secs, properties.max_duration_secs, 0, Integer.MAX_VALUE);
        checkRange(violations, Property.heartbeat_secs, properties.heartbeat_secs, 0, Integer.MAX_VALUE);
        checkRange(violations, Property.connection_timeout_millis, properties.connection_timeout_millis, 0, Integer.MAX_VALUE);
        checkRange(violations, Property.rpc_timeout_secs, properties.rpc_timeout_secs, 0, Integer.MAX_VALUE);
        checkRange(violations, Property.rpc_max_foreign_redeliveries, properties.rpc_max_foreign_redeliveries, 0, Integer.MAX_VALUE);

        if (properties.tls_enabled && properties.tls_truststore_path != null && properties.tls_truststore_password == null) {
            violations.add("tls_truststore_path is set but tls_truststore_password is missing");
        }

        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
    }

    public static boolean isValidExchangeType(String type) {
        if (type == null) {
            return false;
        }
        return EXCHANGE_TYPES.contains(type)
                || (type.startsWith(PLUGIN_EXCHANGE_TYPE_PREFIX) && type.length() > PLUGIN_EXCHANGE_TYPE_PREFIX.length());
    }

    private static void checkRange(List<String> violations, Property property, int value, int min, int max) {
        if (value < min || value > max) {
            violations.add(property + " must be between " + min + " and " + max + ", was " + value);
        }
    }
}
