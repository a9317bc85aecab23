package com.vidnyan.introspect.domain.type;

import java.util.Objects;

/**
 * A raw type reference as encountered in a namespace, before resolution.
 * Never present in a resolved model.
 */
public record UnresolvedReference(String namespace, String reference, String cType) implements TypeExpression {

    public UnresolvedReference {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(reference, "reference");
    }

    @Override
    public String display() {
        return "?" + reference;
    }
}
