package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.With;

import java.util.List;
import java.util.Objects;

/**
 * Callback (function-pointer) declaration, either global or nested in a class.
 */
@With
public record Callback(String name, String cType, List<Parameter> parameters, TypeExpression returnType) {

    public Callback {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
