package com.meltwater.amqpexchange;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates message builders pre-filled with the defaults of a profile: its content type,
 * persistent delivery mode and a fixed set of application headers.
 */
public class MessageFactory {

    private final String contentType;
    private final DeliveryMode deliveryMode;
    private final Map<String, Object> applicationHeaders;

    public MessageFactory(AmqpProperties properties) {
        this(properties.content_type, DeliveryMode.persistent, Collections.<String, Object>emptyMap());
    }

    public MessageFactory(String contentType, DeliveryMode deliveryMode, Map<String, Object> applicationHeaders) {
        this.contentType = contentType;
        this.deliveryMode = deliveryMode;
        this.applicationHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(applicationHeaders));
    }

    public Message.Builder builder(byte[] body) {
        return Message.builder(body)
                .withContentType(contentType)
                .withDeliveryMode(deliveryMode)
                .withHeaders(applicationHeaders);
    }

    public Message.Builder builder(String body) {
        return builder(body.getBytes(StandardCharsets.UTF_8));
    }

    public Message create(String body) {
        return builder(body).build();
    }

    public Message create(byte[] body) {
        return builder(body).build();
    }
}
