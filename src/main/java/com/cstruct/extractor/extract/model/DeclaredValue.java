package com.cstruct.extractor.extract.model;

/**
 * Entry of the value catalog: either a {@link ScalarValue} or a {@link StructInstance}.
 */
public interface DeclaredValue {

    String getName();

    boolean isStructInstance();
}
