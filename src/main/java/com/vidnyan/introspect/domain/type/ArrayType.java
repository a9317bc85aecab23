package com.vidnyan.introspect.domain.type;

import java.util.Objects;

public record ArrayType(TypeExpression element, int depth) implements TypeExpression {

    public ArrayType {
        Objects.requireNonNull(element, "element");
        if (depth < 1) {
            throw new IllegalArgumentException("Array depth must be at least 1, got " + depth);
        }
    }

    public static ArrayType of(TypeExpression element) {
        return new ArrayType(element, 1);
    }

    @Override
    public String display() {
        return element.display() + "[]".repeat(depth);
    }
}
