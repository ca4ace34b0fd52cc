package com.nomadtap.tap.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable extraction progress marker for one stream, e.g. {@code {"ModifyIndex": 1042}}.
 */
public final class Bookmark {

    public static final String COMPLETED = "completed";
    public static final String PROGRESS_MARKERS = "progress_markers";

    private static final Bookmark EMPTY = new Bookmark(Map.of());

    private final Map<String, Object> values;

    private Bookmark(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Bookmark empty() {
        return EMPTY;
    }

    public static Bookmark of(Map<String, Object> values) {
        return values == null || values.isEmpty() ? EMPTY : new Bookmark(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Optional<Long> getLong(String key) {
        Object value = values.get(key);
        return value instanceof Number n ? Optional.of(n.longValue()) : Optional.empty();
    }

    public Bookmark with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new Bookmark(copy);
    }

    public Bookmark without(String key) {
        if (!values.containsKey(key)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove(key);
        return of(copy);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Bookmark other && values.equals(other.values);
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
