package com.cstruct.extractor.extract;

public enum ProblemKind {
    /** An initialized declarator that does not declare a plain identifier. */
    UNEXPECTED_DECLARATOR,
    /** A brace initializer for a struct tag with no catalogued fields. */
    UNKNOWN_STRUCT_TYPE
}
