package com.meltwater.amqpexchange;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThat;

public class MessageTest {

    @Test
    public void priority_is_clamped() {
        assertThat(Message.builder("a").withPriority(300).build().properties.getPriority(), is(255));
        assertThat(Message.builder("a").withPriority(-1).build().properties.getPriority(), is(0));
        assertThat(Message.builder("a").withPriority(7).build().properties.getPriority(), is(7));
    }

    @Test
    public void headers_keep_their_order_and_are_unique() {
        Message message = Message.builder("a")
                .withHeader("b", 1)
                .withHeader("a", 2)
                .withHeader("b", 3)
                .withHeaders(ImmutableMap.of("c", 4))
                .withoutHeader("a")
                .build();

        assertThat(new ArrayList<>(message.getHeaders().keySet()), is(Arrays.asList("b", "c")));
        assertThat(message.getHeader("b"), is(3));
        assertThat(message.getHeader("a"), is(nullValue()));
    }

    @Test
    public void to_builder_keeps_the_properties() {
        Message original = Message.builder("body")
                .withCorrelationId("c-1")
                .withReplyTo("replies")
                .withDeliveryMode(DeliveryMode.persistent)
                .withHeader("h", "v")
                .build();

        Message copy = original.toBuilder().withMessageId("m-1").build();

        assertThat(copy.getCorrelationId(), is("c-1"));
        assertThat(copy.getReplyTo(), is("replies"));
        assertThat(copy.properties.getDeliveryMode(), is(2));
        assertThat(copy.getHeader("h"), is("v"));
        assertThat(copy.properties.getMessageId(), is("m-1"));
        assertThat(copy.getBodyAsString(), is("body"));
        assertThat(original.properties.getMessageId(), is(nullValue()));
    }

    @Test
    public void factory_fills_in_the_profile_defaults() {
        MessageFactory factory = new MessageFactory(new AmqpProperties.Builder().with(Property.content_type, "application/json").build());

        Message message = factory.create("{}");

        assertThat(message.properties.getContentType(), is("application/json"));
        assertThat(DeliveryMode.fromCode(message.properties.getDeliveryMode()), is(DeliveryMode.persistent));
    }

    @Test(expected = IllegalStateException.class)
    public void messages_that_were_not_delivered_have_no_delivery_tag() {
        Message.builder("a").build().getDeliveryTag();
    }
}
