package com.vidnyan.introspect.domain.type;

import java.util.Objects;

/**
 * Native scalar type of the scripting runtime ({@code string}, {@code number}, ...).
 */
public record PrimitiveType(String name) implements TypeExpression {

    public static final PrimitiveType STRING = new PrimitiveType("string");
    public static final PrimitiveType NUMBER = new PrimitiveType("number");
    public static final PrimitiveType BOOLEAN = new PrimitiveType("boolean");
    public static final PrimitiveType VOID = new PrimitiveType("void");
    public static final PrimitiveType BIGINT = new PrimitiveType("bigint");
    public static final PrimitiveType POINTER = new PrimitiveType("pointer");

    public PrimitiveType {
        Objects.requireNonNull(name, "name");
    }

    public boolean isVoid() {
        return "void".equals(name);
    }

    @Override
    public String display() {
        return name;
    }
}
