package com.vidnyan.introspect.domain.type;

import com.vidnyan.introspect.domain.conflict.ConflictKind;

import java.util.Objects;

/**
 * Wraps a member type whose override was classified as conflicting.
 * The inner type is kept for diagnostics only; type comparison treats the marker as {@code any}.
 */
public record ConflictMarker(TypeExpression inner, ConflictKind kind) implements TypeExpression {

    public ConflictMarker {
        Objects.requireNonNull(inner, "inner");
        Objects.requireNonNull(kind, "kind");
        if (inner instanceof ConflictMarker) {
            throw new IllegalArgumentException("ConflictMarker cannot wrap another ConflictMarker");
        }
    }

    /**
     * Wrap a type, replacing an existing marker instead of nesting it.
     */
    public static ConflictMarker wrap(TypeExpression type, ConflictKind kind) {
        return new ConflictMarker(unwrap(type), kind);
    }

    /**
     * The original type beneath any marker.
     */
    public static TypeExpression unwrap(TypeExpression type) {
        return type instanceof ConflictMarker marker ? marker.inner() : type;
    }

    @Override
    public String display() {
        return "any /* " + kind + ": " + inner.display() + " */";
    }
}
