package com.arriraw.core;

import com.arriraw.types.Value;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered name to value mapping produced by one extraction. Iteration follows insertion order;
 * writing an existing name replaces its value but keeps its original position.
 */
@EqualsAndHashCode
public final class MetadataMap {
    private final LinkedHashMap<String, Value> entries = new LinkedHashMap<>();

    public MetadataMap put(String name, Value value) {
        entries.put(Objects.requireNonNull(name, "Name cannot be null"),
                Objects.requireNonNull(value, "Value cannot be null"));
        return this;
    }

    public MetadataMap putAll(Map<String, Value> values) {
        values.forEach(this::put);
        return this;
    }

    /**
     * Merge another map into this one; entries of {@code other} win on name collision.
     */
    public MetadataMap putAll(MetadataMap other) {
        return putAll(other.entries);
    }

    public Value get(String name) {
        return entries.get(name);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public List<String> nameList() {
        return List.copyOf(entries.keySet());
    }

    public Map<String, Value> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Plain Java view (strings, numbers, nested maps) in the same order, for serialization.
     */
    public Map<String, Object> toJavaMap() {
        var result = new LinkedHashMap<String, Object>();
        entries.forEach((name, value) -> result.put(name, value.toJava()));
        return result;
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
