package com.meltwater.amqpexchange;

/**
 * The lifecycle of a {@link Request}.
 *
 * unconnected -> connected -> declared -> ready, and closed from any state.
 */
public enum RequestState {
    unconnected,
    connected,
    /** the exchange is declared */
    declared,
    /** the queue (if any) is declared and bound */
    ready,
    closed
}
