package com.vidnyan.introspect.domain.type;

/**
 * Top marker: compatible with everything.
 */
public record AnyType() implements TypeExpression {

    public static final AnyType INSTANCE = new AnyType();

    @Override
    public String display() {
        return "any";
    }
}
