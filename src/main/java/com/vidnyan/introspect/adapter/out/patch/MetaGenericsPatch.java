package com.vidnyan.introspect.adapter.out.patch;

import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.patch.PatchException;
import com.vidnyan.introspect.domain.patch.VersionedNamespacePatch;
import com.vidnyan.introspect.domain.type.GenerifiedType;
import com.vidnyan.introspect.domain.type.Identifier;
import com.vidnyan.introspect.domain.type.TypeExpression;
import com.vidnyan.introspect.domain.type.UnresolvedReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Instantiates the parent of {@code Meta.BackgroundActor} as
 * {@code Clutter.Actor<Clutter.LayoutManager, Meta.BackgroundContent>}.
 */
@Component
@Order(20)
@ConditionalOnProperty(prefix = "introspect.patches", name = "infer-generics", havingValue = "true", matchIfMissing = true)
public class MetaGenericsPatch extends VersionedNamespacePatch {

    private static final String CLUTTER = "Clutter";

    public MetaGenericsPatch() {
        super("Meta", majorVersions(10, 20));
    }

    @Override
    public Namespace apply(Namespace namespace) {
        if (namespace.dependencies().stream().noneMatch(d -> CLUTTER.equals(d.name()))) {
            throw new PatchException(name() + ": " + namespace.key() + " does not depend on " + CLUTTER);
        }
        BaseClass backgroundContent = requireClass(namespace, "BackgroundContent");
        BaseClass backgroundActor = requireClass(namespace, "BackgroundActor");

        TypeExpression parent = backgroundActor.superType();
        if (parent == null || parent instanceof GenerifiedType) {
            return namespace;
        }

        GenerifiedType generified = new GenerifiedType(parentIdentifier(namespace, parent), List.of(
                new Identifier(CLUTTER, "LayoutManager"),
                backgroundContent.getType()));
        return namespace.withClass(backgroundActor.withSuperType(generified));
    }

    private Identifier parentIdentifier(Namespace namespace, TypeExpression parent) {
        if (parent instanceof Identifier identifier) {
            return identifier;
        }
        if (parent instanceof UnresolvedReference unresolved) {
            String reference = unresolved.reference();
            int dot = reference.indexOf('.');
            return dot > 0
                    ? new Identifier(reference.substring(0, dot), reference.substring(dot + 1))
                    : new Identifier(namespace.name(), reference);
        }
        throw new PatchException(name() + ": unexpected parent " + parent.display());
    }
}
