package com.vidnyan.introspect.domain.type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An identifier instantiated with concrete generic arguments.
 */
public record GenerifiedType(Identifier base, List<TypeExpression> args) implements TypeExpression {

    public GenerifiedType {
        Objects.requireNonNull(base, "base");
        args = List.copyOf(args);
    }

    @Override
    public String display() {
        return base.display() + args.stream()
                .map(TypeExpression::display)
                .collect(Collectors.joining(", ", "<", ">"));
    }
}
