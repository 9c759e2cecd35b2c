package com.meltwater.amqpexchange;

/**
 * How a consume loop ended.
 */
public class ConsumeResult {

    public final LoopState state;
    public final long processed;

    public ConsumeResult(LoopState state, long processed) {
        this.state = state;
        this.processed = processed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsumeResult that = (ConsumeResult) o;
        return processed == that.processed && state == that.state;
    }

    @Override
    public int hashCode() {
        return 31 * state.hashCode() + Long.hashCode(processed);
    }

    @Override
    public String toString() {
        return "ConsumeResult{state=" + state + ", processed=" + processed + '}';
    }
}
