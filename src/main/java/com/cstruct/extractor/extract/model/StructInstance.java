package com.cstruct.extractor.extract.model;

import java.util.List;

import lombok.Value;

/**
 * A variable of struct type initialized with a brace list.
 */
@Value
public class StructInstance implements DeclaredValue {
    String typeName;
    String instanceName;
    List<FieldBinding> bindings;

    @Override
    public String getName() {
        return instanceName;
    }

    @Override
    public boolean isStructInstance() {
        return true;
    }
}
