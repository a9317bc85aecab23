package com.vidnyan.introspect.domain.type;

import java.util.List;
import java.util.stream.Collectors;

public record TupleType(List<TypeExpression> elements) implements TypeExpression {

    public TupleType {
        elements = List.copyOf(elements);
    }

    public int arity() {
        return elements.size();
    }

    @Override
    public String display() {
        return elements.stream()
                .map(TypeExpression::display)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
