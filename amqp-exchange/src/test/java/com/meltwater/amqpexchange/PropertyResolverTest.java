package com.meltwater.amqpexchange;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class PropertyResolverTest {

    private final PropertyResolver resolver = new PropertyResolver();

    private final AmqpProperties base = new AmqpProperties.Builder()
            .withExchange("orders", "topic")
            .withQueueArguments(ImmutableMap.of("x-message-ttl", 60_000))
            .build();

    @Test
    public void overrides_of_one_call_do_not_leak_into_the_next() {
        AmqpProperties first = resolver.resolve(base, PropertyOverrides
                .of(Property.queue, "orders-q")
                .with(Property.routing, Arrays.asList("orders.created", "orders.updated"))
                .with(Property.exchange_type, "direct"));
        assertThat(first.queue, is("orders-q"));
        assertThat(first.routing, is(Arrays.asList("orders.created", "orders.updated")));
        assertThat(first.exchange_type, is("direct"));

        AmqpProperties second = resolver.resolve(base, PropertyOverrides.none());
        assertThat(second.queue, is(""));
        assertThat(second.routing, is(Collections.<String>emptyList()));
        assertThat(second.exchange_type, is("topic"));
        assertThat(second, is(base));
    }

    @Test
    public void map_overrides_replace_the_base_value() {
        AmqpProperties resolved = resolver.resolve(base,
                PropertyOverrides.of(Property.queue_arguments, ImmutableMap.of("x-max-length", 5)));

        assertThat(resolved.queue_arguments, is(ImmutableMap.<String, Object>of("x-max-length", 5)));
        assertThat(base.queue_arguments, is(ImmutableMap.<String, Object>of("x-message-ttl", 60_000)));
    }

    @Test
    public void a_single_routing_key_is_a_one_element_list() {
        AmqpProperties resolved = resolver.resolve(base, PropertyOverrides.of(Property.routing, "orders.created"));
        assertThat(resolved.routing, is(Collections.singletonList("orders.created")));
    }

    @Test
    public void invalid_exchange_types_are_rejected() {
        for (String type : Arrays.asList("invalid", "", "Topic", "x-", null)) {
            try {
                resolver.resolve(base, PropertyOverrides.of(Property.exchange_type, type));
                fail("Expected exchange type '" + type + "' to be rejected");
            } catch (ConfigurationException e) {
                assertThat(e.getMessage(), containsString("Invalid exchange type"));
            }
        }
    }

    @Test
    public void standard_and_plugin_exchange_types_are_accepted() {
        for (String type : Arrays.asList("topic", "direct", "fanout", "headers", "x-delayed-message", "x-consistent-hash")) {
            assertThat(resolver.resolve(base, PropertyOverrides.of(Property.exchange_type, type)).exchange_type, is(type));
        }
    }

    @Test
    public void empty_exchange_is_rejected() {
        try {
            resolver.resolve(base, PropertyOverrides.of(Property.exchange, ""));
            fail();
        } catch (ConfigurationException e) {
            assertThat(e.getViolations(), hasItem("exchange must not be empty"));
        }
    }

    @Test
    public void quorum_queues_can_not_be_exclusive_or_auto_deleted() {
        try {
            resolver.resolve(base, PropertyOverrides
                    .of(Property.queue, "orders-q")
                    .with(Property.queue_arguments, ImmutableMap.of("x-queue-type", "quorum"))
                    .with(Property.queue_exclusive, true)
                    .with(Property.queue_auto_delete, true));
            fail();
        } catch (ConfigurationException e) {
            assertThat(e.getViolations(), hasItem("x-queue-type=quorum conflicts with queue_exclusive=true"));
            assertThat(e.getViolations(), hasItem("x-queue-type=quorum conflicts with queue_auto_delete=true"));
        }
    }

    @Test
    public void stream_queues_must_be_durable() {
        try {
            resolver.resolve(base, PropertyOverrides
                    .of(Property.queue_arguments, ImmutableMap.of("x-queue-type", "stream"))
                    .with(Property.queue_durable, false));
            fail();
        } catch (ConfigurationException e) {
            assertThat(e.getViolations(), hasItem("x-queue-type=stream conflicts with queue_durable=false"));
        }
    }

    @Test
    public void all_violations_are_reported_together() {
        try {
            resolver.resolve(base, PropertyOverrides
                    .of(Property.exchange, "")
                    .with(Property.exchange_type, "bogus")
                    .with(Property.port, 0)
                    .with(Property.queue_nowait, true));
            fail();
        } catch (ConfigurationException e) {
            assertThat(e.getViolations(), hasSize(4));
        }
    }

    @Test
    public void max_priority_must_fit_in_a_byte() {
        try {
            resolver.resolve(base, PropertyOverrides.of(Property.queue_arguments, ImmutableMap.of("x-max-priority", 300)));
            fail();
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString("x-max-priority"));
        }
    }

    @Test
    public void truststore_requires_its_password() {
        try {
            resolver.resolve(base, PropertyOverrides
                    .of(Property.tls_enabled, true)
                    .with(Property.tls_truststore_path, "/etc/ssl/broker.jks"));
            fail();
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), containsString("tls_truststore_password"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void overrides_with_the_wrong_type_are_rejected() {
        PropertyOverrides.of(Property.port, "5672");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknown_override_keys_are_rejected() {
        PropertyOverrides.fromMap(ImmutableMap.of("exchange_kind", "topic"));
    }
}
