package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.With;

import java.util.Objects;

@With
public record Constant(String name, String cType, TypeExpression type, String value) {

    public Constant {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
