package com.vidnyan.introspect.domain.subtype;

import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.Generic;
import com.vidnyan.introspect.domain.model.NamespaceRegistry;
import com.vidnyan.introspect.domain.type.AnyType;
import com.vidnyan.introspect.domain.type.ArrayType;
import com.vidnyan.introspect.domain.type.ConflictMarker;
import com.vidnyan.introspect.domain.type.GenericRef;
import com.vidnyan.introspect.domain.type.GenerifiedType;
import com.vidnyan.introspect.domain.type.Identifier;
import com.vidnyan.introspect.domain.type.NeverType;
import com.vidnyan.introspect.domain.type.NullableType;
import com.vidnyan.introspect.domain.type.PrimitiveType;
import com.vidnyan.introspect.domain.type.ScopedIdentifier;
import com.vidnyan.introspect.domain.type.TupleType;
import com.vidnyan.introspect.domain.type.TypeExpression;
import com.vidnyan.introspect.domain.type.UnionType;
import com.vidnyan.introspect.domain.type.UnresolvedReference;

import java.util.List;

/**
 * Structural compatibility between two type expressions.
 *
 * Pure and total: unresolved references and conflict markers count as {@code any};
 * {@code never} is only compatible with itself and takes precedence over {@code any}.
 */
public final class SubtypeChecker {

    private final NamespaceRegistry registry;
    private final Ancestry ancestry;

    public SubtypeChecker(NamespaceRegistry registry) {
        this.registry = registry;
        this.ancestry = new Ancestry(registry);
    }

    /**
     * Whether {@code child}, declared in {@code childScope}, may stand where {@code parent},
     * declared in {@code parentScope}, is expected.
     *
     * @param childScope  declaration owning the child type, used to look up generic constraints; may be null
     * @param parentScope declaration owning the parent type; may be null
     */
    public boolean isSubtypeOf(Identifier childScope, Identifier parentScope,
                               TypeExpression rawChild, TypeExpression rawParent) {
        TypeExpression child = normalize(rawChild);
        TypeExpression parent = normalize(rawParent);

        if (parent instanceof NeverType) {
            return child instanceof NeverType;
        }
        if (child instanceof NeverType) {
            return false;
        }
        if (child instanceof AnyType || parent instanceof AnyType) {
            return true;
        }

        if (parent instanceof NullableType nullableParent) {
            TypeExpression childInner = child instanceof NullableType nullableChild ? nullableChild.inner() : child;
            return isSubtypeOf(childScope, parentScope, childInner, nullableParent.inner());
        }
        if (child instanceof NullableType) {
            return false;
        }

        if (child instanceof UnionType childUnion) {
            if (parent instanceof UnionType parentUnion) {
                return childUnion.members().stream().allMatch(c -> parentUnion.members().stream()
                        .anyMatch(p -> isSubtypeOf(childScope, parentScope, c, p)));
            }
            return childUnion.members().stream()
                    .allMatch(c -> isSubtypeOf(childScope, parentScope, c, parent));
        }
        if (parent instanceof UnionType parentUnion) {
            return parentUnion.members().stream()
                    .anyMatch(p -> isSubtypeOf(childScope, parentScope, child, p));
        }

        if (child instanceof GenericRef childRef) {
            if (parent instanceof GenericRef parentRef && childRef.name().equals(parentRef.name())) {
                return true;
            }
            return isSubtypeOf(childScope, parentScope, constraintOf(childRef, childScope), parent);
        }
        if (parent instanceof GenericRef parentRef) {
            return isSubtypeOf(childScope, parentScope, child, constraintOf(parentRef, parentScope));
        }

        if (child instanceof ArrayType childArray) {
            return parent instanceof ArrayType parentArray
                    && childArray.depth() == parentArray.depth()
                    && isSubtypeOf(childScope, parentScope, childArray.element(), parentArray.element());
        }
        if (child instanceof TupleType childTuple) {
            return parent instanceof TupleType parentTuple
                    && childTuple.arity() == parentTuple.arity()
                    && allCompatible(childScope, parentScope, childTuple.elements(), parentTuple.elements());
        }
        if (child instanceof PrimitiveType childPrimitive) {
            return childPrimitive.equals(parent);
        }
        if (child instanceof ScopedIdentifier) {
            return child.equals(parent);
        }
        if (child instanceof GenerifiedType childGeneric) {
            if (parent instanceof GenerifiedType parentGeneric) {
                return ancestry.extendsOrImplements(childGeneric.base(), parentGeneric.base())
                        && childGeneric.args().size() == parentGeneric.args().size()
                        && allCompatible(childScope, parentScope, childGeneric.args(), parentGeneric.args());
            }
            return parent instanceof Identifier parentId
                    && ancestry.extendsOrImplements(childGeneric.base(), parentId);
        }
        if (child instanceof Identifier childId) {
            if (parent instanceof Identifier parentId) {
                return ancestry.extendsOrImplements(childId, parentId);
            }
            if (parent instanceof GenerifiedType parentGeneric) {
                return ancestry.extendsOrImplements(childId, parentGeneric.base());
            }
            return false;
        }
        return false;
    }

    /**
     * Same check without generic scopes.
     */
    public boolean isSubtypeOf(TypeExpression child, TypeExpression parent) {
        return isSubtypeOf(null, null, child, parent);
    }

    private boolean allCompatible(Identifier childScope, Identifier parentScope,
                                  List<TypeExpression> children, List<TypeExpression> parents) {
        for (int i = 0; i < children.size(); i++) {
            if (!isSubtypeOf(childScope, parentScope, children.get(i), parents.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static TypeExpression normalize(TypeExpression type) {
        if (type == null || type instanceof UnresolvedReference || type instanceof ConflictMarker) {
            return AnyType.INSTANCE;
        }
        return type;
    }

    /**
     * The declared bound of a generic reference: its own constraint when bounded,
     * otherwise the constraint declared on the scope's generics list.
     */
    private TypeExpression constraintOf(GenericRef ref, Identifier scope) {
        if (!(ref.constraint() instanceof AnyType) || scope == null) {
            return ref.constraint();
        }
        return registry.findClass(scope)
                .flatMap(cls -> cls.findGeneric(ref.name()))
                .map(Generic::constraint)
                .orElse(AnyType.INSTANCE);
    }

    /**
     * Convenience for class-to-class checks.
     */
    public boolean isSubclassOf(BaseClass child, BaseClass parent) {
        return ancestry.extendsOrImplements(child.getType(), parent.getType());
    }
}
