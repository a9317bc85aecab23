package com.vidnyan.introspect.domain.type;

import java.util.Objects;

public record NullableType(TypeExpression inner) implements TypeExpression {

    public NullableType {
        Objects.requireNonNull(inner, "inner");
        if (inner instanceof NullableType) {
            throw new IllegalArgumentException("Nullable cannot wrap another nullable");
        }
    }

    /**
     * Wrap a type, collapsing nested nullability.
     */
    public static TypeExpression of(TypeExpression inner) {
        if (inner instanceof NullableType) {
            return inner;
        }
        return new NullableType(inner);
    }

    @Override
    public TypeExpression nullable() {
        return this;
    }

    @Override
    public String display() {
        return inner.display() + " | null";
    }
}
