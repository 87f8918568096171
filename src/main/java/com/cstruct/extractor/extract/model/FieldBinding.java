package com.cstruct.extractor.extract.model;

import lombok.Value;

/**
 * One (field name, expression) pair of a struct instance. The same field name can
 * appear more than once when a nested initializer is flattened.
 */
@Value
public class FieldBinding {
    String fieldName;
    SimpleExpression expression;

    public String getExpressionText() {
        return expression.render();
    }
}
