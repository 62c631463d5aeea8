package com.trading.pipeline.term;

import com.trading.pipeline.errors.InvalidParamsException;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable named scalar parameters bound to a term at construction.
 *
 * <p>
 * Values are restricted to numbers, strings and booleans. Integral numbers are
 * normalized to {@code Long} and floating point numbers to {@code Double}, so
 * {@code of("n", 5)} and {@code of("n", 5L)} describe the same term.
 * Equality is by content, independent of insertion order.
 */
public final class TermParams {
    public static final TermParams EMPTY = new TermParams(new TreeMap<>());

    private final SortedMap<String, Object> values;

    private TermParams(SortedMap<String, Object> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    public static TermParams of(String name, Object value) {
        return ofMap(Map.of(name, value));
    }

    public static TermParams of(String name1, Object value1, String name2, Object value2) {
        return ofMap(Map.of(name1, value1, name2, value2));
    }

    public static TermParams ofMap(Map<String, ?> params) {
        if (params.isEmpty())
            return EMPTY;
        TreeMap<String, Object> normalized = new TreeMap<>();
        for (var e : params.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank())
                throw new InvalidParamsException("Parameter names must be non-blank");
            normalized.put(e.getKey(), normalize(e.getKey(), e.getValue()));
        }
        return new TermParams(normalized);
    }

    private static Object normalize(String name, Object value) {
        if (value instanceof Double || value instanceof Float)
            return ((Number) value).doubleValue();
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)
            return ((Number) value).longValue();
        if (value instanceof String || value instanceof Boolean)
            return value;
        throw new InvalidParamsException("Parameter '" + name + "' must be a number, string or boolean, got "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    public Set<String> names() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Object get(String name) {
        Object v = values.get(name);
        if (v == null)
            throw new IllegalArgumentException("Unknown parameter: " + name);
        return v;
    }

    public double getDouble(String name) {
        Object v = get(name);
        if (v instanceof Number n)
            return n.doubleValue();
        throw new IllegalArgumentException("Parameter '" + name + "' is not numeric: " + v);
    }

    public int getInt(String name) {
        Object v = get(name);
        if (v instanceof Number n)
            return Math.toIntExact(n.longValue());
        throw new IllegalArgumentException("Parameter '" + name + "' is not numeric: " + v);
    }

    public boolean getBoolean(String name) {
        Object v = get(name);
        if (v instanceof Boolean b)
            return b;
        throw new IllegalArgumentException("Parameter '" + name + "' is not a boolean: " + v);
    }

    public String getString(String name) {
        return get(name).toString();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TermParams p && values.equals(p.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
