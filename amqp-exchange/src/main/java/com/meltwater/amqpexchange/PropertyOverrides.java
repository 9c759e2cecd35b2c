package com.meltwater.amqpexchange;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A partial set of property values applied on top of a base {@link AmqpProperties} for a single call.
 *
 * Values are type checked when they are added, so an override that can never be applied fails at the call site.
 * Keys are replaced as a whole: overriding a map or list property replaces the base value, it is never merged with it.
 *
 * @see PropertyResolver
 */
public class PropertyOverrides {

    private final EnumMap<Property, Object> values = new EnumMap<>(Property.class);

    public static PropertyOverrides none() {
        return new PropertyOverrides();
    }

    public static PropertyOverrides of(Property property, Object value) {
        return new PropertyOverrides().with(property, value);
    }

    /**
     * Creates overrides from a map keyed by property name.
     *
     * @throws IllegalArgumentException if the map contains an unknown key or a value of the wrong type
     */
    public static PropertyOverrides fromMap(Map<String, ?> map) {
        PropertyOverrides overrides = new PropertyOverrides();
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            overrides.with(Property.fromKey(entry.getKey()), entry.getValue());
        }
        return overrides;
    }

    public PropertyOverrides with(Property property, Object value) {
        values.put(property, property.coerce(value));
        return this;
    }

    /**
     * @return a new instance holding the values of this one with the values of {@code other} on top
     */
    public PropertyOverrides plus(PropertyOverrides other) {
        PropertyOverrides merged = new PropertyOverrides();
        merged.values.putAll(values);
        merged.values.putAll(other.values);
        return merged;
    }

    public boolean contains(Property property) {
        return values.containsKey(property);
    }

    public Object get(Property property) {
        return values.get(property);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<Property, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    void applyTo(AmqpProperties.Builder builder) {
        for (Map.Entry<Property, Object> entry : values.entrySet()) {
            builder.with(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public String toString() {
        Map<Property, Object> printable = new EnumMap<>(values);
        if (printable.containsKey(Property.password)) {
            printable.put(Property.password, "*****");
        }
        return printable.toString();
    }
}
