package com.vidnyan.introspect.adapter.out.patch;

import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.Property;
import com.vidnyan.introspect.domain.patch.VersionedNamespacePatch;
import com.vidnyan.introspect.domain.type.TypeExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Makes {@code Clutter.Actor} generic over its layout manager and content
 * ({@code Actor<A extends LayoutManager, B extends Content>}) and {@code Clutter.Clone}
 * generic over its source actor.
 */
@Component
@Order(10)
@ConditionalOnProperty(prefix = "introspect.patches", name = "infer-generics", havingValue = "true", matchIfMissing = true)
public class ClutterGenericsPatch extends VersionedNamespacePatch {

    public ClutterGenericsPatch() {
        super("Clutter", majorVersions(10, 20));
    }

    @Override
    public Namespace apply(Namespace namespace) {
        BaseClass actor = requireClass(namespace, "Actor");
        BaseClass content = requireClass(namespace, "Content");
        BaseClass layoutManager = requireClass(namespace, "LayoutManager");
        BaseClass clone = requireClass(namespace, "Clone");

        if (!actor.generics().isEmpty()) {
            return namespace;
        }

        BaseClass genericActor = actor
                .addGeneric(layoutManager.getType(), layoutManager.getType())
                .addGeneric(content.getType(), content.getType());
        TypeExpression layoutParam = genericActor.findGeneric("A").orElseThrow().reference();
        TypeExpression contentParam = genericActor.findGeneric("B").orElseThrow().reference();
        genericActor = retypeProperties(genericActor, Set.of("layout_manager", "layoutManager"), layoutParam);
        genericActor = retypeProperties(genericActor, Set.of("content"), contentParam);

        BaseClass genericClone = clone.generics().isEmpty()
                ? clone.addGeneric(actor.getType(), actor.getType())
                : clone;
        TypeExpression sourceParam = genericClone.findGeneric("A").orElseThrow().reference();
        genericClone = retypeProperties(genericClone, Set.of("source"), sourceParam);

        return namespace.withClass(genericActor).withClass(genericClone);
    }

    private static BaseClass retypeProperties(BaseClass cls, Set<String> names, TypeExpression type) {
        List<Property> properties = cls.properties().stream()
                .map(p -> names.contains(p.name()) ? p.withType(type) : p)
                .toList();
        return cls.withProperties(properties);
    }
}
