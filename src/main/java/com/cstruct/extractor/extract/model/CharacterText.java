package com.cstruct.extractor.extract.model;

import lombok.Value;

/**
 * Character constant payload, escapes as written ({@code '\n'} keeps {@code \n}).
 */
@Value
public class CharacterText implements SimpleExpression {
    String text;

    @Override
    public String render() {
        return "Character(" + SimpleExpression.quote(text) + ")";
    }
}
