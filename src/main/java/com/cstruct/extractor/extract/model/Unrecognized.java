package com.cstruct.extractor.extract.model;

import lombok.Value;

/**
 * Any expression form without a dedicated variant, carried as the structural dump
 * of its syntax tree.
 */
@Value
public class Unrecognized implements SimpleExpression {
    String text;

    @Override
    public String render() {
        return "Unrecognized(" + text + ")";
    }
}
