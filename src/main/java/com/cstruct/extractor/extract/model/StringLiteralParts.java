package com.cstruct.extractor.extract.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * Adjacent string literals, one element per token, not concatenated.
 */
@Value
public class StringLiteralParts implements SimpleExpression {
    List<String> parts;

    @Override
    public String render() {
        return parts.stream()
                .map(SimpleExpression::quote)
                .collect(Collectors.joining(", ", "StringLiteral([", "])"));
    }
}
