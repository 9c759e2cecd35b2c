package com.meltwater.amqpexchange;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message body together with its AMQP properties.
 *
 * Messages received from the broker also carry the {@link Envelope} (delivery tag, redelivery flag, exchange and routing key)
 * and the tag of the consumer that received them. Messages created with the {@link Builder} have no envelope.
 *
 * Instances are immutable, use {@link #toBuilder()} to derive a modified copy.
 */
public class Message {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 255;

    /**
     * The message body
     */
    public final byte[] body;

    /**
     * The message properties. For example correlationId, replyTo, content type and custom headers.
     */
    public final AMQP.BasicProperties properties;

    /**
     * The delivery metadata, null for messages that were not received from the broker.
     */
    public final Envelope envelope;

    /**
     * The tag of the consumer that received the message, null for messages that were not received from the broker.
     */
    public final String consumerTag;

    public Message(byte[] body, AMQP.BasicProperties properties) {
        this(body, properties, null, null);
    }

    public Message(byte[] body, AMQP.BasicProperties properties, Envelope envelope, String consumerTag) {
        assert body != null;
        this.body = body;
        this.properties = properties == null ? new AMQP.BasicProperties() : properties;
        this.envelope = envelope;
        this.consumerTag = consumerTag;
    }

    public static Builder builder(byte[] body) {
        return new Builder(body);
    }

    public static Builder builder(String body) {
        return new Builder(body.getBytes(StandardCharsets.UTF_8));
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isDelivered() {
        return envelope != null;
    }

    /**
     * @throws IllegalStateException if the message was not received from the broker
     */
    public long getDeliveryTag() {
        if (envelope == null) {
            throw new IllegalStateException("The message has not been delivered by the broker.");
        }
        return envelope.getDeliveryTag();
    }

    public String getCorrelationId() {
        return properties.getCorrelationId();
    }

    public String getReplyTo() {
        return properties.getReplyTo();
    }

    public Object getHeader(String name) {
        Map<String, Object> headers = properties.getHeaders();
        return headers == null ? null : headers.get(name);
    }

    public Map<String, Object> getHeaders() {
        Map<String, Object> headers = properties.getHeaders();
        return headers == null ? Collections.<String, Object>emptyMap() : Collections.unmodifiableMap(headers);
    }

    public Builder toBuilder() {
        return new Builder(body).withProperties(properties);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Message message = (Message) o;
        return properties.equals(message.properties)
                && (envelope == null ? message.envelope == null : envelope.equals(message.envelope))
                && Arrays.equals(body, message.body);
    }

    @Override
    public int hashCode() {
        int result = properties.hashCode();
        result = 31 * result + (envelope == null ? 0 : envelope.hashCode());
        result = 31 * result + Arrays.hashCode(body);
        return result;
    }

    @Override
    public String toString() {
        return "Message{" +
                "bodySize=" + body.length +
                ", properties=" + properties +
                ", deliveryTag=" + (envelope == null ? null : envelope.getDeliveryTag()) +
                ", consumerTag=" + consumerTag +
                '}';
    }

    public static class Builder {

        private final byte[] body;
        private final Map<String, Object> headers = new LinkedHashMap<>();
        private AMQP.BasicProperties.Builder props = new AMQP.BasicProperties.Builder();

        Builder(byte[] body) {
            assert body != null;
            this.body = body;
        }

        /**
         * Replaces all properties (including headers) with the given ones.
         */
        public Builder withProperties(AMQP.BasicProperties properties) {
            this.props = properties.builder();
            headers.clear();
            if (properties.getHeaders() != null) {
                headers.putAll(properties.getHeaders());
            }
            return this;
        }

        public Builder withContentType(String contentType) {
            props.contentType(contentType);
            return this;
        }

        public Builder withContentEncoding(String contentEncoding) {
            props.contentEncoding(contentEncoding);
            return this;
        }

        public Builder withDeliveryMode(DeliveryMode deliveryMode) {
            props.deliveryMode(deliveryMode == null ? null : deliveryMode.code);
            return this;
        }

        /**
         * Sets the priority, values outside the range 0-255 are clamped to it.
         */
        public Builder withPriority(int priority) {
            props.priority(Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority)));
            return this;
        }

        public Builder withCorrelationId(String correlationId) {
            props.correlationId(correlationId);
            return this;
        }

        public Builder withReplyTo(String replyTo) {
            props.replyTo(replyTo);
            return this;
        }

        public Builder withExpiration(String expiration) {
            props.expiration(expiration);
            return this;
        }

        public Builder withMessageId(String messageId) {
            props.messageId(messageId);
            return this;
        }

        public Builder withTimestamp(Date timestamp) {
            props.timestamp(timestamp);
            return this;
        }

        public Builder withType(String type) {
            props.type(type);
            return this;
        }

        public Builder withUserId(String userId) {
            props.userId(userId);
            return this;
        }

        public Builder withAppId(String appId) {
            props.appId(appId);
            return this;
        }

        /**
         * Adds or replaces a header. Header names are unique and keep their insertion order.
         */
        public Builder withHeader(String name, Object value) {
            headers.put(name, value);
            return this;
        }

        public Builder withHeaders(Map<String, Object> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public Builder withoutHeader(String name) {
            headers.remove(name);
            return this;
        }

        public Message build() {
            return new Message(body, props.headers(headers.isEmpty() ? null : new LinkedHashMap<>(headers)).build());
        }
    }
}
