package com.meltwater.amqpexchange;

/**
 * Snapshot of a queue as reported by the broker when it was declared.
 */
public class QueueInfo {

    /**
     * The queue name. For queues declared with an empty name this is the name generated by the broker.
     */
    public final String name;
    public final int messageCount;
    public final int consumerCount;

    public QueueInfo(String name, int messageCount, int consumerCount) {
        this.name = name;
        this.messageCount = messageCount;
        this.consumerCount = consumerCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueInfo that = (QueueInfo) o;
        return messageCount == that.messageCount && consumerCount == that.consumerCount && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + messageCount;
        result = 31 * result + consumerCount;
        return result;
    }

    @Override
    public String toString() {
        return "QueueInfo{" +
                "name='" + name + '\'' +
                ", messageCount=" + messageCount +
                ", consumerCount=" + consumerCount +
                '}';
    }
}
