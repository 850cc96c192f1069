package com.foo.extract.service;

import com.foo.extract.match.ValueComparator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A parsed configuration block: lower-case keys mapped to the comparator built from the
 * operator and value columns, in sheet order. A repeated key keeps its last value.
 */
public final class ConfigBlock {

    private final Map<String, ValueComparator> entries;

    ConfigBlock(Map<String, ValueComparator> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    public Optional<ValueComparator> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Map<String, ValueComparator> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return "ConfigBlock" + entries;
    }
}
