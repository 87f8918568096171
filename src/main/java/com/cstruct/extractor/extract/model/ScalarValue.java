package com.cstruct.extractor.extract.model;

import lombok.Value;

@Value
public class ScalarValue implements DeclaredValue {
    String name;
    SimpleExpression expression;

    public String getExpressionText() {
        return expression.render();
    }

    @Override
    public boolean isStructInstance() {
        return false;
    }
}
