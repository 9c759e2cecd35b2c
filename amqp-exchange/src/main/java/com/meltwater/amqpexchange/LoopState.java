package com.meltwater.amqpexchange;

/**
 * The state of a consume loop. Every state but {@link #running} is terminal.
 */
public enum LoopState {
    running,
    /** the handler asked to stop or the shutdown signal message was acknowledged */
    stopped_by_signal,
    /** the configured number of messages has been processed */
    stopped_by_limit,
    /** no message arrived within the idle timeout, or the overall duration was exceeded */
    timed_out,
    /** a non persistent loop has processed every message that was ready when it started */
    drained
}
