package com.vidnyan.introspect.domain.type;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Structural helpers over the type grammar.
 */
public final class TypeExpressions {

    private TypeExpressions() {
    }

    /**
     * Rebuild a type bottom-up, replacing every leaf for which {@code leafMapper} returns a new node.
     * Composite nodes are reconstructed; the input is never modified.
     */
    public static TypeExpression mapLeaves(TypeExpression type, Function<TypeExpression, TypeExpression> leafMapper) {
        if (type instanceof ArrayType array) {
            return new ArrayType(mapLeaves(array.element(), leafMapper), array.depth());
        }
        if (type instanceof TupleType tuple) {
            return new TupleType(tuple.elements().stream().map(e -> mapLeaves(e, leafMapper)).toList());
        }
        if (type instanceof UnionType union) {
            Set<TypeExpression> members = new LinkedHashSet<>();
            union.members().forEach(m -> members.add(mapLeaves(m, leafMapper)));
            return new UnionType(members);
        }
        if (type instanceof NullableType nullable) {
            return NullableType.of(mapLeaves(nullable.inner(), leafMapper));
        }
        if (type instanceof GenerifiedType generified) {
            TypeExpression base = leafMapper.apply(generified.base());
            List<TypeExpression> args = generified.args().stream().map(a -> mapLeaves(a, leafMapper)).toList();
            if (base instanceof Identifier identifier) {
                return new GenerifiedType(identifier, args);
            }
            return base;
        }
        if (type instanceof GenericRef generic) {
            return new GenericRef(generic.name(), mapLeaves(generic.constraint(), leafMapper));
        }
        if (type instanceof ConflictMarker marker) {
            return ConflictMarker.wrap(mapLeaves(marker.inner(), leafMapper), marker.kind());
        }
        return leafMapper.apply(type);
    }

    /**
     * Whether any leaf of the type is still an {@link UnresolvedReference}.
     */
    public static boolean containsUnresolved(TypeExpression type) {
        if (type instanceof UnresolvedReference) {
            return true;
        }
        if (type instanceof ArrayType array) {
            return containsUnresolved(array.element());
        }
        if (type instanceof TupleType tuple) {
            return tuple.elements().stream().anyMatch(TypeExpressions::containsUnresolved);
        }
        if (type instanceof UnionType union) {
            return union.members().stream().anyMatch(TypeExpressions::containsUnresolved);
        }
        if (type instanceof NullableType nullable) {
            return containsUnresolved(nullable.inner());
        }
        if (type instanceof GenerifiedType generified) {
            return generified.args().stream().anyMatch(TypeExpressions::containsUnresolved);
        }
        if (type instanceof GenericRef generic) {
            return containsUnresolved(generic.constraint());
        }
        if (type instanceof ConflictMarker marker) {
            return containsUnresolved(marker.inner());
        }
        return false;
    }
}
