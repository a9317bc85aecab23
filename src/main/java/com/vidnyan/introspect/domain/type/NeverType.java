package com.vidnyan.introspect.domain.type;

/**
 * Bottom marker: compatible with nothing but itself.
 */
public record NeverType() implements TypeExpression {

    public static final NeverType INSTANCE = new NeverType();

    @Override
    public String display() {
        return "never";
    }
}
