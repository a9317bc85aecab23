package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.With;

import java.util.Objects;

@With
public record Field(String name, TypeExpression type, boolean writable) implements ClassMember {

    public Field {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Field of(String name, TypeExpression type) {
        return new Field(name, type, true);
    }

    @Override
    public MemberKind memberKind() {
        return MemberKind.FIELD;
    }
}
