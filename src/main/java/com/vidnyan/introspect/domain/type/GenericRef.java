package com.vidnyan.introspect.domain.type;

import java.util.Objects;

/**
 * Reference to a generic parameter in scope, carrying its declared constraint
 * ({@link AnyType} when unbounded).
 */
public record GenericRef(String name, TypeExpression constraint) implements TypeExpression {

    public GenericRef {
        Objects.requireNonNull(name, "name");
        constraint = constraint == null ? AnyType.INSTANCE : constraint;
    }

    public static GenericRef of(String name) {
        return new GenericRef(name, AnyType.INSTANCE);
    }

    @Override
    public String display() {
        return name;
    }
}
