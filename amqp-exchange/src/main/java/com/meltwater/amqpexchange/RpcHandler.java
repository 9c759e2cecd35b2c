package com.meltwater.amqpexchange;

/**
 * Computes the response of a remote procedure call request.
 *
 * @see ExchangeClient#serve(String, RpcHandler, PropertyOverrides)
 */
public interface RpcHandler {

    /**
     * @return the response body sent back to the caller
     */
    byte[] handle(Message request) throws Exception;
}
