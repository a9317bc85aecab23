package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.AnyType;
import com.vidnyan.introspect.domain.type.GenericRef;
import com.vidnyan.introspect.domain.type.TypeExpression;

import java.util.Objects;

/**
 * Generic parameter declared on a class.
 */
public record Generic(String name, TypeExpression constraint, TypeExpression defaultType) {

    public Generic {
        Objects.requireNonNull(name, "name");
        constraint = constraint == null ? AnyType.INSTANCE : constraint;
    }

    /**
     * Reference to this parameter, carrying its constraint.
     */
    public GenericRef reference() {
        return new GenericRef(name, constraint);
    }
}
