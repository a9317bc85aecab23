package com.vidnyan.introspect.domain.type;

import com.vidnyan.introspect.domain.conflict.ConflictKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeExpressionTest {

    private static final Identifier FILE = new Identifier("Gio", "File");

    @Test
    void unionEquality_ShouldIgnoreMemberOrder() {
        UnionType a = UnionType.of(List.of(PrimitiveType.STRING, FILE));
        UnionType b = UnionType.of(List.of(FILE, PrimitiveType.STRING));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void emptyUnion_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> UnionType.of(List.of()));
    }

    @Test
    void nullableOf_ShouldCollapseNesting() {
        TypeExpression once = NullableType.of(FILE);
        TypeExpression twice = NullableType.of(once);

        assertEquals(once, twice);
        assertThrows(IllegalArgumentException.class, () -> new NullableType(new NullableType(FILE)));
    }

    @Test
    void conflictMarkerWrap_ShouldNeverNest() {
        ConflictMarker first = ConflictMarker.wrap(FILE, ConflictKind.FIELD_NAME_CONFLICT);
        ConflictMarker second = ConflictMarker.wrap(first, ConflictKind.ACCESSOR_PROPERTY_CONFLICT);

        assertEquals(FILE, second.inner());
        assertEquals(ConflictKind.ACCESSOR_PROPERTY_CONFLICT, second.kind());
        assertEquals(FILE, ConflictMarker.unwrap(second));
        assertThrows(IllegalArgumentException.class,
                () -> new ConflictMarker(first, ConflictKind.FIELD_NAME_CONFLICT));
    }

    @Test
    void arrayDepth_ShouldBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ArrayType(FILE, 0));
        assertEquals("Gio.File[][]", new ArrayType(FILE, 2).display());
    }

    @Test
    void mapLeaves_ShouldRebuildCompositesWithoutTouchingInput() {
        UnresolvedReference raw = new UnresolvedReference("Gio", "File", null);
        TypeExpression input = NullableType.of(new ArrayType(
                UnionType.of(List.of(raw, PrimitiveType.NUMBER)), 1));

        TypeExpression mapped = TypeExpressions.mapLeaves(input,
                leaf -> leaf instanceof UnresolvedReference ? FILE : leaf);

        assertTrue(TypeExpressions.containsUnresolved(input));
        assertFalse(TypeExpressions.containsUnresolved(mapped));
        assertEquals(NullableType.of(new ArrayType(UnionType.of(List.of(PrimitiveType.NUMBER, FILE)), 1)), mapped);
    }

    @Test
    void genericRef_ShouldDefaultConstraintToAny() {
        assertEquals(AnyType.INSTANCE, GenericRef.of("T").constraint());
        assertEquals(AnyType.INSTANCE, new GenericRef("T", null).constraint());
    }
}
