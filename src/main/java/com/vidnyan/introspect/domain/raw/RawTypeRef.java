package com.vidnyan.introspect.domain.raw;

import java.util.List;

/**
 * Unresolved type reference as handed over by the parsing collaborator.
 *
 * @param name       raw reference string, e.g. {@code Gio.File}, {@code ResultFlatMapFunc}, {@code utf8}
 * @param cType      native low-level type name, may be null
 * @param arrayDepth array nesting, 0 for scalars
 * @param elements   tuple elements, when the reference describes a tuple
 * @param members    union members, when the reference describes a union
 */
public record RawTypeRef(
    String name,
    String cType,
    int arrayDepth,
    boolean nullable,
    List<RawTypeRef> elements,
    List<RawTypeRef> members
) {

    public RawTypeRef {
        elements = elements == null ? List.of() : List.copyOf(elements);
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static RawTypeRef named(String name) {
        return new RawTypeRef(name, null, 0, false, List.of(), List.of());
    }

    public static RawTypeRef named(String name, String cType) {
        return new RawTypeRef(name, cType, 0, false, List.of(), List.of());
    }

    public RawTypeRef asArray(int depth) {
        return new RawTypeRef(name, cType, depth, nullable, elements, members);
    }

    public RawTypeRef asNullable() {
        return new RawTypeRef(name, cType, arrayDepth, true, elements, members);
    }
}
