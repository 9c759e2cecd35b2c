package com.meltwater.amqpexchange;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThat;

public class AmqpPropertiesTest {

    @Test
    public void defaults() {
        AmqpProperties properties = new AmqpProperties.Builder().build();

        assertThat(properties.host, is("localhost"));
        assertThat(properties.port, is(5672));
        assertThat(properties.vhost, is("/"));
        assertThat(properties.exchange, is("amq.topic"));
        assertThat(properties.exchange_type, is("topic"));
        assertThat(properties.exchange_durable, is(true));
        assertThat(properties.queue_durable, is(true));
        assertThat(properties.persistent, is(true));
        assertThat(properties.timeout_secs, is(0));
        assertThat(properties.qos_prefetch_count, is(1));
        assertThat(properties.publish_timeout_secs, is(30));
        assertThat(properties.content_type, is("text/plain"));
        assertThat(properties.shutdown_signal, is(nullValue()));
    }

    @Test
    public void can_be_built_from_json() {
        AmqpProperties properties = new AmqpProperties.Builder(
                "host: 'rabbit', port: 5673, exchange: 'orders', routing: ['orders.created', 'orders.updated'], " +
                "queue_arguments: {'x-max-priority': 10}, persistent: false").build();

        assertThat(properties.host, is("rabbit"));
        assertThat(properties.port, is(5673));
        assertThat(properties.exchange, is("orders"));
        assertThat(properties.routing, is(Arrays.asList("orders.created", "orders.updated")));
        assertThat(properties.queue_arguments, is(ImmutableMap.<String, Object>of("x-max-priority", 10)));
        assertThat(properties.persistent, is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknown_json_keys_are_rejected() {
        new AmqpProperties.Builder("{\"hostname\": \"rabbit\"}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicate_json_keys_are_rejected() {
        new AmqpProperties.Builder("{\"host\": \"a\", \"host\": \"b\"}");
    }

    @Test
    public void to_string_hides_the_password() {
        AmqpProperties properties = new AmqpProperties.Builder().withCredentials("app", "s3cr3t").build();

        assertThat(properties.toString(), not(containsString("s3cr3t")));
        assertThat(properties.toString(), containsString("\"username\":\"app\""));
    }

    @Test
    public void to_builder_copies_every_value() {
        AmqpProperties properties = new AmqpProperties.Builder()
                .withHost("rabbit")
                .withRoutingKeys("a", "b")
                .withMessageLimit(7)
                .build();

        assertThat(properties.toBuilder().build(), is(properties));
    }
}
