package com.cstruct.extractor.extract.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * Nested brace list kept as one value, elements in source order.
 */
@Value
public class AggregateValue implements SimpleExpression {
    List<SimpleExpression> elements;

    @Override
    public String render() {
        return elements.stream()
                .map(SimpleExpression::render)
                .collect(Collectors.joining(", ", "Aggregate([", "])"));
    }
}
