package com.vidnyan.introspect.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Enumeration or bitfield.
 */
public record EnumDeclaration(String name, String cType, List<String> members, boolean flags) {

    public EnumDeclaration {
        Objects.requireNonNull(name, "name");
        members = members == null ? List.of() : List.copyOf(members);
    }
}
