package com.meltwater.amqpexchange;

import com.google.common.base.Strings;
import com.meltwater.amqpexchange.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declares the exchange, the queue and the bindings described by an {@link AmqpProperties} on a channel.
 *
 * Broker side failures (for example a precondition failure because an existing queue has other arguments)
 * are propagated as the {@link IOException} thrown by the java client. The channel is closed by the broker in that case.
 */
public class TopologyDeclarator {

    private static final Logger log = new Logger(TopologyDeclarator.class);

    static final String LEGACY_HA_POLICY_ARGUMENT = "x-ha-policy";

    private final Channel channel;
    private final AmqpProperties properties;

    public TopologyDeclarator(Channel channel, AmqpProperties properties) {
        this.channel = channel;
        this.properties = properties;
    }

    public void declareExchange() throws IOException {
        if (properties.exchange_passive) {
            channel.exchangeDeclarePassive(properties.exchange);
        } else if (properties.exchange_nowait) {
            channel.exchangeDeclareNoWait(properties.exchange,
                    properties.exchange_type,
                    properties.exchange_durable,
                    properties.exchange_auto_delete,
                    properties.exchange_internal,
                    properties.exchange_arguments);
        } else {
            channel.exchangeDeclare(properties.exchange,
                    properties.exchange_type,
                    properties.exchange_durable,
                    properties.exchange_auto_delete,
                    properties.exchange_internal,
                    properties.exchange_arguments);
        }
        log.debugWithParams("Declared exchange.",
                "exchange", properties.exchange,
                "type", properties.exchange_type,
                "passive", properties.exchange_passive,
                "durable", properties.exchange_durable);
    }

    /**
     * @return true if the properties name a queue or force the declaration of a server named one
     */
    public boolean shouldDeclareQueue() {
        return !Strings.isNullOrEmpty(properties.queue) || properties.queue_force_declare;
    }

    public QueueInfo declareQueue() throws IOException {
        final QueueInfo info;
        if (properties.queue_passive) {
            info = toQueueInfo(channel.queueDeclarePassive(properties.queue));
        } else if (properties.queue_nowait) {
            channel.queueDeclareNoWait(properties.queue,
                    properties.queue_durable,
                    properties.queue_exclusive,
                    properties.queue_auto_delete,
                    queueArguments());
            info = new QueueInfo(properties.queue, 0, 0);
        } else {
            info = toQueueInfo(channel.queueDeclare(properties.queue,
                    properties.queue_durable,
                    properties.queue_exclusive,
                    properties.queue_auto_delete,
                    queueArguments()));
        }
        log.debugWithParams("Declared queue.",
                "queue", info.name,
                "messageCount", info.messageCount,
                "consumerCount", info.consumerCount,
                "passive", properties.queue_passive);
        return info;
    }

    /**
     * Binds the queue once for each configured routing key.
     */
    public void bindQueue(String queueName) throws IOException {
        for (String routingKey : properties.routing) {
            channel.queueBind(queueName, properties.exchange, routingKey);
            log.debugWithParams("Bound queue.",
                    "queue", queueName,
                    "exchange", properties.exchange,
                    "routingKey", routingKey);
        }
    }

    Map<String, Object> queueArguments() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : properties.queue_arguments.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (LEGACY_HA_POLICY_ARGUMENT.equals(entry.getKey())) {
                log.warnWithParams("Ignoring queue argument which is not supported by the broker. Use a policy instead.",
                        "argument", entry.getKey(),
                        "value", entry.getValue(),
                        "queue", properties.queue);
                continue;
            }
            arguments.put(entry.getKey(), entry.getValue());
        }
        return arguments;
    }

    private static QueueInfo toQueueInfo(AMQP.Queue.DeclareOk ok) {
        return new QueueInfo(ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount());
    }
}
