package com.vidnyan.introspect.domain.type;

import java.util.Objects;

/**
 * Reference to a declaration nested inside another named declaration,
 * e.g. a callback declared only within an interface.
 */
public record ScopedIdentifier(String namespace, String container, String name) implements TypeExpression {

    public ScopedIdentifier {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(name, "name");
    }

    public Identifier containerIdentifier() {
        return new Identifier(namespace, container);
    }

    @Override
    public String display() {
        return namespace + "." + container + "." + name;
    }
}
