package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.With;

import java.util.List;
import java.util.Objects;

/**
 * Free-standing namespace function.
 */
@With
public record FunctionDeclaration(String name, String cType, List<Parameter> parameters, TypeExpression returnType) {

    public FunctionDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
