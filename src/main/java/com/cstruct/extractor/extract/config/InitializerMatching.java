package com.cstruct.extractor.extract.config;

/**
 * How brace-initializer elements are paired with struct fields.
 */
public enum InitializerMatching {
    /** The n-th element binds to the n-th field; designators are ignored. */
    POSITIONAL,
    /**
     * A {@code .field =} designator binds by name. Undesignated elements continue after the
     * last bound field, and designators naming an unknown field keep their positional slot.
     */
    DESIGNATED
}
