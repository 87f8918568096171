package com.cstruct.extractor.extract.model;

import lombok.Value;

@Value
public class FloatConstant implements SimpleExpression {
    String text;

    @Override
    public String render() {
        return "Float(" + SimpleExpression.quote(text) + ")";
    }
}
