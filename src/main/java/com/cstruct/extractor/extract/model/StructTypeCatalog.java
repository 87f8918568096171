package com.cstruct.extractor.extract.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Struct tag to {@link StructTypeDefinition}, in first-seen order.
 */
@ToString(doNotUseGetters = true)
@EqualsAndHashCode(doNotUseGetters = true)
public class StructTypeCatalog {

    private final Map<String, StructTypeDefinition> definitions = new LinkedHashMap<>();

    public Optional<StructTypeDefinition> find(String tagName) {
        return Optional.ofNullable(definitions.get(tagName));
    }

    public StructTypeDefinition getOrCreate(String tagName) {
        return definitions.computeIfAbsent(tagName, StructTypeDefinition::new);
    }

    public Collection<StructTypeDefinition> getDefinitions() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    public int size() {
        return definitions.size();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }
}
