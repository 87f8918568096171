package com.cstruct.extractor.extract.model;

import lombok.Value;

@Value
public class IntegerConstant implements SimpleExpression {
    String text;

    @Override
    public String render() {
        return "Integer(" + SimpleExpression.quote(text) + ")";
    }
}
