package com.meltwater.amqpexchange;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when a set of properties describes a topology that can never be declared.
 * Always raised before any network i/o is done.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super("Invalid amqp configuration: " + Joiner.on("; ").join(violations));
        this.violations = ImmutableList.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
