package com.meltwater.amqpexchange;

/**
 * Wraps a checked exception thrown by a {@link MessageHandler} or an {@link RpcHandler}.
 */
public class MessageHandlerException extends RuntimeException {

    public MessageHandlerException(Throwable cause) {
        super("Message handler failed: " + cause.getMessage(), cause);
    }
}
