package com.cstruct.extractor.extract.config;

public enum NestedInitializerMode {
    /** Every leaf of a nested brace list is bound to the enclosing field name. */
    FLATTEN,
    /** A nested brace list is bound as a single aggregate expression. */
    AGGREGATE
}
