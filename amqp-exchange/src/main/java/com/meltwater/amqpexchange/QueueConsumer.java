package com.meltwater.amqpexchange;

import java.io.IOException;

/**
 * Runs a blocking consume loop on the calling thread.
 *
 * The loop ends when the handler asks to stop, when the message limit is reached, when a timeout expires
 * or, for non persistent loops, when the messages that were ready at start have been processed.
 * These endings are reported in the returned {@link ConsumeResult}.
 *
 * Exceptions thrown by the handler, a broker side cancel of the consumer and a channel shutdown end the loop
 * with an exception instead.
 */
public interface QueueConsumer {

    ConsumeResult consume(QueueInfo queue, MessageHandler handler) throws IOException;
}
