package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.With;

import java.util.Objects;

@With
public record Property(String name, TypeExpression type, boolean readable, boolean writable) implements ClassMember {

    public Property {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Property of(String name, TypeExpression type) {
        return new Property(name, type, true, true);
    }

    @Override
    public MemberKind memberKind() {
        return MemberKind.PROPERTY;
    }
}
