package com.vidnyan.introspect.domain.type;

import java.util.Objects;

/**
 * Reference to a named declaration in a given namespace.
 */
public record Identifier(String namespace, String name) implements TypeExpression {

    public Identifier {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    public static Identifier of(String namespace, String name) {
        return new Identifier(namespace, name);
    }

    /**
     * Qualified form, e.g. {@code GObject.Object}.
     */
    public String qualifiedName() {
        return namespace + "." + name;
    }

    @Override
    public String display() {
        return qualifiedName();
    }
}
