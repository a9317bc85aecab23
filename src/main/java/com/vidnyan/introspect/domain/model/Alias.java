package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.With;

import java.util.Objects;

@With
public record Alias(String name, String cType, TypeExpression target) {

    public Alias {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
    }
}
