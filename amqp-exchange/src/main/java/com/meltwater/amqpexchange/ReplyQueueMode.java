package com.meltwater.amqpexchange;

/**
 * Where an {@link RpcClient} call waits for its reply.
 */
public enum ReplyQueueMode {
    /**
     * A server named, exclusive and auto-deleted queue is declared for every call. Replies that do not match
     * the call can only be stale replies of earlier calls, so they are dropped.
     */
    exclusive_per_call,
    /**
     * The queue named by {@link Property#rpc_reply_queue} is used by several callers. Replies that do not match
     * are requeued for the other callers until they have bounced {@link Property#rpc_max_foreign_redeliveries} times.
     * <p>
     * The count is kept per call and is not bounded in time. The reply consumer runs with a prefetch of one so a
     * requeued reply can reach another consumer of the queue, but the broker may still hand it back to the same one.
     * A caller whose reply is bounced by others more often than the limit loses it, so keep the limit well above
     * the number of concurrent callers, or use {@link #exclusive_per_call}.
     */
    shared;

    public static ReplyQueueMode of(AmqpProperties properties) {
        return properties.rpc_reply_queue == null || properties.rpc_reply_queue.isEmpty() ? exclusive_per_call : shared;
    }
}
