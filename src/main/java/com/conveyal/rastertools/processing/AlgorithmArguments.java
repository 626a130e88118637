package com.conveyal.rastertools.processing;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * The configured argument values handed to a RasterAlgorithm on each call, such as a kernel size.
 * Immutable, so a single instance is safely shared by all workers.
 */
public class AlgorithmArguments {

    public static final AlgorithmArguments EMPTY = new AlgorithmArguments(ImmutableMap.of());

    private final ImmutableMap<String, Object> values;

    public AlgorithmArguments (Map<String, ?> values) {
        this.values = ImmutableMap.copyOf(values);
    }

    public boolean contains (String name) {
        return values.containsKey(name);
    }

    public Object get (String name) {
        return values.get(name);
    }

    public int getInt (String name, int defaultValue) {
        Object value = values.get(name);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument " + name + " is not an integer: " + value, e);
        }
    }

    public double getDouble (String name, double defaultValue) {
        Object value = values.get(name);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument " + name + " is not a number: " + value, e);
        }
    }

    public Map<String, Object> asMap () {
        return values;
    }

    @Override
    public String toString () {
        return values.toString();
    }

}
