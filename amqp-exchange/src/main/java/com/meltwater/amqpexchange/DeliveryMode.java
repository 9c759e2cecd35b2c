package com.meltwater.amqpexchange;

import com.rabbitmq.client.BasicProperties;

/**
 * Descriptive names for the delivery mode codes of a message.
 *
 * @see BasicProperties#getDeliveryMode()
 * @see {https://www.rabbitmq.com/amqp-0-9-1-reference.html}
 */
public enum DeliveryMode {
    non_persistent(1),
    persistent(2);

    public final int code;

    DeliveryMode(int code) {
        this.code = code;
    }

    public static DeliveryMode fromCode(Integer code) {
        if (code == null) {
            return null;
        }
        for (DeliveryMode mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown delivery mode " + code);
    }
}
