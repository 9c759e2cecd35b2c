package com.meltwater.amqpexchange.util;

import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Logger which outputs a message followed by a list of named values.
 *
 * <p>
 * Example usage:
 * <code><pre>
 * Logger log = new Logger(Request.class);
 * log.infoWithParams("Declared exchange", "exchange", "orders", "type", "topic");
 * </pre></code>
 * Which outputs something like this (depending on the slf4j backend configuration):
 * <pre>INFO Request - Declared exchange [ exchange="orders", type="topic" ]</pre>
 * </p>
 *
 * <p>Values are rendered with their toString() method. Maps and arrays are expanded.</p>
 */
public class Logger {
    private final org.slf4j.Logger logger;

    private static final List<Class<?>> UNQUOTED_TYPES = Arrays.asList(
            Boolean.class,
            Byte.class,
            Character.class,
            Double.class,
            Float.class,
            Integer.class,
            Long.class,
            Short.class);

    public Logger(Class<?> clazz) {
        this(LoggerFactory.getLogger(clazz));
    }

    protected Logger(org.slf4j.Logger logger) {
        this.logger = logger;
    }

    public void traceWithParams(String message, Object... arguments) {
        if (!logger.isTraceEnabled()) {
            return;
        }
        try {
            logger.trace(buildLogMessage(message, arguments));
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
        }
    }

    public void debugWithParams(String message, Object... arguments) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        try {
            logger.debug(buildLogMessage(message, arguments));
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
        }
    }

    public void infoWithParams(String message, Object... arguments) {
        if (!logger.isInfoEnabled()) {
            return;
        }
        try {
            logger.info(buildLogMessage(message, arguments));
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
        }
    }

    public void warnWithParams(String message, Object... arguments) {
        if (!logger.isWarnEnabled()) {
            return;
        }
        try {
            logger.warn(buildLogMessage(message, arguments));
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
        }
    }

    public void warnWithParams(String message, Throwable t, Object... arguments) {
        if (!logger.isWarnEnabled()) {
            return;
        }
        try {
            logger.warn(buildLogMessage(message, arguments), t);
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
            logger.warn(message, t);
        }
    }

    public void errorWithParams(String message, Object... arguments) {
        if (!logger.isErrorEnabled()) {
            return;
        }
        try {
            logger.error(buildLogMessage(message, arguments));
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
        }
    }

    public void errorWithParams(String message, Throwable t, Object... arguments) {
        if (!logger.isErrorEnabled()) {
            return;
        }
        try {
            logger.error(buildLogMessage(message, arguments), t);
        } catch (IllegalArgumentException e) {
            logMessageAssemblyFailure(message, arguments);
            logger.error(message, t);
        }
    }

    private void logMessageAssemblyFailure(String message, Object... arguments) {
        logger.error(
                "Failed to assemble log message for logger {}! Arguments must be declared in pairs! message={}, arguments={}",
                logger.getName(), message, Arrays.toString(arguments));
    }

    protected String buildLogMessage(String message, Object[] arguments) {
        if (arguments.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Arguments must be declared in pairs: (message, key, value, key2, value2, ...)");
        }
        final StringBuilder sb = new StringBuilder(message);
        if (arguments.length == 0) {
            return sb.toString();
        }
        sb.append(" [ ");
        for (int i = 0; i < arguments.length; i += 2) {
            append(sb, arguments[i], arguments[i + 1]);
            if (i + 2 < arguments.length) {
                sb.append(", ");
            }
        }
        sb.append(" ]");
        return sb.toString();
    }

    private void append(StringBuilder sb, Object key, Object value) {
        sb.append(key);
        sb.append('=');
        if (value instanceof Object[]) {
            sb.append(Arrays.toString((Object[]) value));
        } else if (value instanceof Map) {
            sb.append(value);
        } else if (isUnquoted(value)) {
            sb.append(value);
        } else {
            sb.append('"');
            sb.append(value);
            sb.append('"');
        }
    }

    private boolean isUnquoted(Object o) {
        return o == null || UNQUOTED_TYPES.contains(o.getClass());
    }
}
