package com.cstruct.extractor.extract.model;

import java.util.Optional;

import lombok.Value;

/**
 * Catalog key of a declared value: the struct tag of its declaration (null for
 * non-struct declarations) and the declared name.
 */
@Value
public class ValueKey {
    String contextTag;
    String name;

    public Optional<String> getContext() {
        return Optional.ofNullable(contextTag);
    }
}
