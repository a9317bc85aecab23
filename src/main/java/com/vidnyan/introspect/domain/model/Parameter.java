package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.With;

import java.util.Objects;

@With
public record Parameter(String name, TypeExpression type, Direction direction, boolean varArgs) {

    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        direction = direction == null ? Direction.IN : direction;
    }

    public static Parameter in(String name, TypeExpression type) {
        return new Parameter(name, type, Direction.IN, false);
    }

    public static Parameter out(String name, TypeExpression type) {
        return new Parameter(name, type, Direction.OUT, false);
    }
}
