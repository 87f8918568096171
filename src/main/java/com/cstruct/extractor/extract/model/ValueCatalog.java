package com.cstruct.extractor.extract.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Declared values keyed by {@link ValueKey}, in first-seen order. The first value
 * stored under a key is kept.
 */
@ToString(doNotUseGetters = true)
@EqualsAndHashCode(doNotUseGetters = true)
public class ValueCatalog {

    private final Map<ValueKey, DeclaredValue> values = new LinkedHashMap<>();

    public boolean contains(ValueKey key) {
        return values.containsKey(key);
    }

    public Optional<DeclaredValue> find(ValueKey key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * @return false when the key already had a value, which is left in place
     */
    public boolean putIfAbsent(ValueKey key, DeclaredValue value) {
        return values.putIfAbsent(key, value) == null;
    }

    public Collection<DeclaredValue> getValues() {
        return Collections.unmodifiableCollection(values.values());
    }

    public Map<ValueKey, DeclaredValue> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
