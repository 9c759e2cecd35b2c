package com.meltwater.amqpexchange;

import com.rabbitmq.client.AMQP;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicReference;

import static com.jayway.awaitility.Awaitility.await;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ExchangeClientTest {

    private final AmqpProperties base = new AmqpProperties.Builder().withExchange("orders", "topic").build();
    private MockBroker broker;
    private ExchangeClient client;

    @Before
    public void setup() throws Exception {
        broker = new MockBroker();
        client = new ExchangeClient(base, broker.factory);
    }

    @Test
    public void publish_applies_the_profile_defaults_to_string_bodies() throws Exception {
        assertThat(client.publish("orders.created", "{\"id\":1}", PropertyOverrides.none()), is(true));

        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(broker.channel).basicPublish(eq("orders"), eq("orders.created"), eq(false), properties.capture(), any(byte[].class));
        assertThat(properties.getValue().getContentType(), is("text/plain"));
        assertThat(properties.getValue().getDeliveryMode(), is(DeliveryMode.persistent.code));
        verify(broker.channel, never()).confirmSelect();
        verify(broker.connectionManager).shutdown();
    }

    @Test
    public void mandatory_from_the_overrides_publishes_with_confirms() throws Exception {
        when(broker.channel.waitForConfirms(anyLong())).thenReturn(true);

        boolean published = client.publish("orders.created", "{}", PropertyOverrides.of(Property.mandatory, true));

        assertThat(published, is(true));
        verify(broker.channel).confirmSelect();
        verify(broker.channel).basicPublish(eq("orders"), eq("orders.created"), eq(true), any(AMQP.BasicProperties.class), any(byte[].class));
        verify(broker.connectionManager).shutdown();
    }

    @Test
    public void invalid_overrides_fail_before_connecting() throws Exception {
        try {
            client.publish("orders.created", "{}", PropertyOverrides.of(Property.exchange_type, "bogus"));
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertThat(e.getMessage(), startsWith("Invalid exchange type"));
        }
        assertThat(broker.connections, is(empty()));
    }

    @Test
    public void batch_is_sent_on_one_request_and_cleared() throws Exception {
        client.batchBasicPublish("orders.created", "1");
        client.batchBasicPublish("orders.updated", "2");
        assertThat(client.pendingBatchSize(), is(2));

        assertThat(client.batchPublish(PropertyOverrides.none()), is(2));

        assertThat(client.pendingBatchSize(), is(0));
        assertThat(broker.connections.size(), is(1));
        InOrder inOrder = inOrder(broker.channel);
        inOrder.verify(broker.channel).basicPublish(eq("orders"), eq("orders.created"), eq(false), any(AMQP.BasicProperties.class), eq("1".getBytes(StandardCharsets.UTF_8)));
        inOrder.verify(broker.channel).basicPublish(eq("orders"), eq("orders.updated"), eq(false), any(AMQP.BasicProperties.class), eq("2".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void batches_belong_to_the_client_instance() throws Exception {
        ExchangeClient other = new ExchangeClient(base, broker.factory);
        client.batchBasicPublish("orders.created", "1");

        assertThat(other.pendingBatchSize(), is(0));
        assertThat(other.batchPublish(PropertyOverrides.none()), is(0));
        assertThat(client.pendingBatchSize(), is(1));
    }

    @Test
    public void empty_batch_does_not_connect() throws Exception {
        assertThat(client.batchPublish(PropertyOverrides.none()), is(0));
        assertThat(broker.connections, is(empty()));
    }

    @Test
    public void batch_is_kept_when_the_connection_fails() throws Exception {
        client.batchBasicPublish("orders.created", "1");
        doThrow(new IOException("connection refused")).when(broker.connectionManager).connect();

        try {
            client.batchPublish(PropertyOverrides.none());
            fail("Expected IOException");
        } catch (IOException expected) {
            assertThat(client.pendingBatchSize(), is(1));
        }
    }

    @Test
    public void retrying_a_partly_sent_batch_only_sends_the_rest() throws Exception {
        doNothing().doThrow(new IOException("channel closed"))
                .when(broker.channel).basicPublish(eq("orders"), anyString(), eq(false), any(AMQP.BasicProperties.class), any(byte[].class));
        client.batchBasicPublish("orders.created", "1");
        client.batchBasicPublish("orders.created", "2");

        try {
            client.batchPublish(PropertyOverrides.none());
            fail("Expected IOException");
        } catch (IOException expected) {
            assertThat(client.pendingBatchSize(), is(1));
        }

        doNothing().when(broker.channel).basicPublish(eq("orders"), anyString(), eq(false), any(AMQP.BasicProperties.class), any(byte[].class));
        assertThat(client.batchPublish(PropertyOverrides.none()), is(1));

        assertThat(client.pendingBatchSize(), is(0));
        verify(broker.channel, times(1)).basicPublish(eq("orders"), eq("orders.created"), eq(false), any(AMQP.BasicProperties.class), eq("1".getBytes(StandardCharsets.UTF_8)));
        verify(broker.channel, times(2)).basicPublish(eq("orders"), eq("orders.created"), eq(false), any(AMQP.BasicProperties.class), eq("2".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void null_overrides_mean_no_overrides() throws Exception {
        broker.enqueue("a");

        ConsumeResult result = client.consume("orders-q", (message, resolver) -> {
            resolver.acknowledge(message);
            resolver.stopWhenProcessed();
        }, null);
        client.batchBasicPublish("orders.created", "1");

        assertThat(result, is(new ConsumeResult(LoopState.stopped_by_signal, 1)));
        assertThat(client.publish("orders.created", "{}", null), is(true));
        assertThat(client.batchPublish(null), is(1));
    }

    @Test
    public void listen_accepts_null_overrides() throws Exception {
        broker.enqueue("a");

        ConsumeResult result = client.listen("orders.created", (message, resolver) -> {
            resolver.acknowledge(message);
            resolver.stopWhenProcessed();
        }, null);

        assertThat(result, is(new ConsumeResult(LoopState.stopped_by_signal, 1)));
        verify(broker.channel).queueBind(ArgumentMatchers.startsWith(ExchangeClient.LISTENER_QUEUE_PREFIX), eq("orders"), eq("orders.created"));
    }

    @Test
    public void consume_uses_the_given_queue() throws Exception {
        broker.enqueue("a", "b");

        ConsumeResult result = client.consume("orders-q", (message, resolver) -> resolver.acknowledge(message),
                PropertyOverrides.of(Property.message_limit, 2));

        assertThat(result, is(new ConsumeResult(LoopState.stopped_by_limit, 2)));
        verify(broker.channel).queueDeclare(eq("orders-q"), eq(true), eq(false), eq(false), anyMap());
        verify(broker.channel).basicAck(1, false);
        verify(broker.channel).basicAck(2, false);
        verify(broker.connectionManager).shutdown();
    }

    @Test
    public void handler_failures_propagate_and_the_request_is_shut_down() throws Exception {
        broker.enqueue("a");

        try {
            client.consume("orders-q", (message, resolver) -> {
                throw new IllegalStateException("boom");
            }, PropertyOverrides.none());
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), is("boom"));
        }
        verify(broker.connectionManager).shutdown();
    }

    @Test
    public void consume_async_emits_the_loop_result() {
        broker.enqueue("a");
        AtomicReference<ConsumeResult> result = new AtomicReference<>();

        client.consumeAsync("orders-q", (message, resolver) -> resolver.acknowledge(message),
                PropertyOverrides.of(Property.message_limit, 1))
                .subscribe(result::set);

        await().atMost(5, SECONDS).until(() -> result.get() != null);
        assertThat(result.get(), is(new ConsumeResult(LoopState.stopped_by_limit, 1)));
    }

    @Test
    public void listen_binds_a_generated_queue_to_every_routing_key() throws Exception {
        broker.enqueue("a");

        client.listen("orders.created, orders.updated", (message, resolver) -> resolver.acknowledge(message),
                PropertyOverrides.of(Property.message_limit, 1));

        ArgumentCaptor<String> queue = ArgumentCaptor.forClass(String.class);
        verify(broker.channel).queueDeclare(queue.capture(), eq(false), eq(false), eq(true), anyMap());
        assertThat(queue.getValue(), startsWith(ExchangeClient.LISTENER_QUEUE_PREFIX));
        verify(broker.channel).queueBind(queue.getValue(), "orders", "orders.created");
        verify(broker.channel).queueBind(queue.getValue(), "orders", "orders.updated");
    }

    @Test
    public void listen_keeps_a_configured_queue() throws Exception {
        broker.enqueue("a");

        client.listen(Collections.singletonList("orders.#"), (message, resolver) -> resolver.acknowledge(message),
                PropertyOverrides.of(Property.queue, "audit").with(Property.message_limit, 1));

        verify(broker.channel).queueDeclare(eq("audit"), eq(true), eq(false), eq(false), anyMap());
        verify(broker.channel).queueBind("audit", "orders", "orders.#");
    }

    @Test(expected = IllegalArgumentException.class)
    public void listen_requires_routing_keys() throws Exception {
        client.listen(Collections.emptyList(), (message, resolver) -> resolver.acknowledge(message), PropertyOverrides.none());
    }

    @Test(expected = IllegalArgumentException.class)
    public void listen_requires_a_non_blank_routing_key_string() throws Exception {
        client.listen(" ", (message, resolver) -> resolver.acknowledge(message), PropertyOverrides.none());
    }

    @Test
    public void serve_replies_to_the_caller_and_acknowledges_the_request() throws Exception {
        broker.enqueue(Message.builder("ping").withCorrelationId("c-1").withReplyTo("caller-q").build());

        client.serve("rpc-q", request -> ("re: " + request.getBodyAsString()).getBytes(StandardCharsets.UTF_8),
                PropertyOverrides.of(Property.message_limit, 1));

        ArgumentCaptor<AMQP.BasicProperties> reply = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        InOrder inOrder = inOrder(broker.channel);
        inOrder.verify(broker.channel).basicPublish(eq(""), eq("caller-q"), eq(false), reply.capture(), eq("re: ping".getBytes(StandardCharsets.UTF_8)));
        inOrder.verify(broker.channel).basicAck(1, false);
        assertThat(reply.getValue().getCorrelationId(), is("c-1"));
    }

    @Test
    public void serve_acknowledges_requests_without_reply_to() throws Exception {
        broker.enqueue("ping");

        client.serve("rpc-q", request -> "pong".getBytes(StandardCharsets.UTF_8), PropertyOverrides.of(Property.message_limit, 1));

        verify(broker.channel, never()).basicPublish(anyString(), anyString(), anyBoolean(), any(AMQP.BasicProperties.class), any(byte[].class));
        verify(broker.channel, times(1)).basicAck(1, false);
    }

    @Test
    public void message_builder_carries_the_profile_defaults() {
        Message message = client.message("hello").withPriority(3).build();

        assertThat(message.properties.getContentType(), is("text/plain"));
        assertThat(message.properties.getPriority(), is(3));
        assertThat(message.getBodyAsString(), is("hello"));
    }
}
