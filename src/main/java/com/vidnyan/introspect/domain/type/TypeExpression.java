package com.vidnyan.introspect.domain.type;

/**
 * A node of the type-expression grammar.
 * Immutable; structural equality is record equality.
 */
public sealed interface TypeExpression
        permits Identifier, ScopedIdentifier, ArrayType, TupleType, UnionType, NullableType,
                GenericRef, GenerifiedType, AnyType, NeverType, PrimitiveType, ConflictMarker,
                UnresolvedReference {

    /**
     * Render as a short human-readable string (used in diagnostics and logs).
     */
    String display();

    /**
     * Wrap this type as nullable.
     */
    default TypeExpression nullable() {
        return NullableType.of(this);
    }
}
