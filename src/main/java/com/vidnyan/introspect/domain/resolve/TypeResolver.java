package com.vidnyan.introspect.domain.resolve;

import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.NamespaceRegistry;
import com.vidnyan.introspect.domain.resolve.Resolution.Fallback;
import com.vidnyan.introspect.domain.resolve.Resolution.Resolved;
import com.vidnyan.introspect.domain.resolve.Resolution.Step;
import com.vidnyan.introspect.domain.type.AnyType;
import com.vidnyan.introspect.domain.type.Identifier;
import com.vidnyan.introspect.domain.type.PrimitiveType;
import com.vidnyan.introspect.domain.type.ScopedIdentifier;
import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves raw type-reference strings against the participating symbol tables.
 *
 * Lookup order, first match wins:
 * <ol>
 *   <li>built-in scalar names</li>
 *   <li>qualified {@code Namespace.Name} or {@code Container.Name} references</li>
 *   <li>compound names splitting into a class prefix and a nested declaration
 *       (longest prefix wins, preferred over any same-named global), then the exact
 *       same-namespace name</li>
 *   <li>native type name annotation</li>
 *   <li>global declaration of that name in dependencies, then in any namespace</li>
 *   <li>fallback to {@code any} with a diagnostic</li>
 * </ol>
 * Pure: no state beyond the immutable registry, never throws for unmatched input.
 */
@Slf4j
public class TypeResolver {

    private static final Map<String, TypeExpression> BUILTIN_TYPES = Map.ofEntries(
            Map.entry("utf8", PrimitiveType.STRING),
            Map.entry("filename", PrimitiveType.STRING),
            Map.entry("string", PrimitiveType.STRING),
            Map.entry("gboolean", PrimitiveType.BOOLEAN),
            Map.entry("boolean", PrimitiveType.BOOLEAN),
            Map.entry("gchar", PrimitiveType.NUMBER),
            Map.entry("guchar", PrimitiveType.NUMBER),
            Map.entry("gunichar", PrimitiveType.NUMBER),
            Map.entry("gshort", PrimitiveType.NUMBER),
            Map.entry("gushort", PrimitiveType.NUMBER),
            Map.entry("gint", PrimitiveType.NUMBER),
            Map.entry("guint", PrimitiveType.NUMBER),
            Map.entry("gint8", PrimitiveType.NUMBER),
            Map.entry("guint8", PrimitiveType.NUMBER),
            Map.entry("gint16", PrimitiveType.NUMBER),
            Map.entry("guint16", PrimitiveType.NUMBER),
            Map.entry("gint32", PrimitiveType.NUMBER),
            Map.entry("guint32", PrimitiveType.NUMBER),
            Map.entry("gint64", PrimitiveType.NUMBER),
            Map.entry("guint64", PrimitiveType.NUMBER),
            Map.entry("glong", PrimitiveType.NUMBER),
            Map.entry("gulong", PrimitiveType.NUMBER),
            Map.entry("gsize", PrimitiveType.NUMBER),
            Map.entry("gssize", PrimitiveType.NUMBER),
            Map.entry("gfloat", PrimitiveType.NUMBER),
            Map.entry("gdouble", PrimitiveType.NUMBER),
            Map.entry("int", PrimitiveType.NUMBER),
            Map.entry("number", PrimitiveType.NUMBER),
            Map.entry("none", PrimitiveType.VOID),
            Map.entry("void", PrimitiveType.VOID),
            Map.entry("gpointer", PrimitiveType.POINTER),
            Map.entry("gconstpointer", PrimitiveType.POINTER),
            Map.entry("va_list", AnyType.INSTANCE)
    );

    private final NamespaceRegistry registry;

    public TypeResolver(NamespaceRegistry registry) {
        this.registry = registry;
    }

    /**
     * Resolve a raw reference without native type name annotation.
     */
    public Resolution resolve(String reference, ResolutionContext context) {
        return resolve(reference, null, context);
    }

    /**
     * Resolve a raw reference.
     *
     * @param cType native type name carried alongside the reference, may be null
     */
    public Resolution resolve(String reference, String cType, ResolutionContext context) {
        Namespace current = context.namespace();

        TypeExpression builtin = BUILTIN_TYPES.get(reference);
        if (builtin != null) {
            return Resolved.of(builtin, Step.PRIMITIVE);
        }

        boolean qualified = reference.indexOf('.') > 0;
        if (qualified) {
            Optional<TypeExpression> match = resolveQualified(reference, current);
            if (match.isPresent()) {
                return Resolved.of(match.get(), Step.QUALIFIED);
            }
        } else {
            Optional<Resolved> scoped = resolveCompound(reference, context);
            if (scoped.isPresent()) {
                return scoped.get();
            }
            if (current.hasTypeDeclaration(reference)) {
                return Resolved.of(new Identifier(current.name(), reference), Step.EXACT);
            }
        }

        Optional<TypeExpression> byCType = resolveNativeTypeName(cType, current);
        if (byCType.isPresent()) {
            return Resolved.of(byCType.get(), Step.NATIVE_TYPE_NAME);
        }

        if (!qualified) {
            for (Namespace candidate : searchOrder(current)) {
                if (candidate.hasTypeDeclaration(reference)) {
                    return Resolved.of(new Identifier(candidate.name(), reference), Step.GLOBAL);
                }
            }
        }

        log.debug("Unresolved reference {} in {}", reference, context.subject());
        return new Fallback(AnyType.INSTANCE, Diagnostic.builder(DiagnosticKind.UNRESOLVED_REFERENCE)
                .namespace(current.key().packageName())
                .subject(context.subject())
                .message("Could not resolve type '" + reference + "', falling back to any")
                .attributes(cType == null
                        ? Map.of("reference", reference)
                        : Map.of("reference", reference, "cType", cType))
                .build());
    }

    private Optional<TypeExpression> resolveQualified(String reference, Namespace current) {
        int dot = reference.indexOf('.');
        String head = reference.substring(0, dot);
        String tail = reference.substring(dot + 1);

        Optional<Namespace> target = registry.find(head);
        if (head.equals(current.name())) {
            target = Optional.of(current);
        }
        if (target.isPresent()) {
            Namespace ns = target.get();
            int innerDot = tail.indexOf('.');
            if (innerDot > 0) {
                return scoped(ns, tail.substring(0, innerDot), tail.substring(innerDot + 1));
            }
            if (ns.hasTypeDeclaration(tail)) {
                return Optional.of(new Identifier(ns.name(), tail));
            }
            return Optional.empty();
        }

        // Container.Name inside the current namespace
        return scoped(current, head, tail);
    }

    private static Optional<TypeExpression> scoped(Namespace ns, String container, String name) {
        return ns.findClass(container)
                .filter(c -> c.hasNested(name))
                .map(c -> new ScopedIdentifier(ns.name(), container, name));
    }

    /**
     * Split {@code ContainerNested} into a class of the current namespace and a declaration nested in it.
     * The longest matching class-name prefix wins.
     */
    private Optional<Resolved> resolveCompound(String reference, ResolutionContext context) {
        Namespace current = context.namespace();
        BaseClass best = null;
        for (BaseClass cls : current.classes().values()) {
            String prefix = cls.name();
            if (prefix.length() >= reference.length() || !reference.startsWith(prefix)) {
                continue;
            }
            String suffix = reference.substring(prefix.length());
            if (cls.hasNested(suffix) && (best == null || prefix.length() > best.name().length())) {
                best = cls;
            }
        }
        if (best == null) {
            return Optional.empty();
        }

        String suffix = reference.substring(best.name().length());
        ScopedIdentifier scoped = new ScopedIdentifier(current.name(), best.name(), suffix);

        List<String> shadowed = new ArrayList<>();
        if (current.hasTypeDeclaration(reference)) {
            shadowed.add(current.name() + "." + reference);
        }
        if (current.hasTypeDeclaration(suffix)) {
            shadowed.add(current.name() + "." + suffix);
        }
        if (shadowed.isEmpty()) {
            return Optional.of(Resolved.of(scoped, Step.SCOPED));
        }

        Diagnostic note = Diagnostic.builder(DiagnosticKind.SCOPED_OVER_GLOBAL)
                .namespace(current.key().packageName())
                .subject(context.subject())
                .message("Resolved '" + reference + "' to " + scoped.display()
                        + " instead of global " + String.join(", ", shadowed))
                .attributes(Map.of("reference", reference, "scoped", scoped.display(), "global", shadowed))
                .build();
        return Optional.of(new Resolved(scoped, Step.SCOPED, note));
    }

    private Optional<TypeExpression> resolveNativeTypeName(String cType, Namespace current) {
        if (cType == null || cType.isEmpty()) {
            return Optional.empty();
        }
        for (Namespace candidate : searchOrder(current)) {
            Optional<TypeExpression> match = candidate.findByCType(cType);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * Current namespace, its dependencies, then every other participating namespace in load order.
     */
    private List<Namespace> searchOrder(Namespace current) {
        Set<String> seen = new LinkedHashSet<>();
        List<Namespace> order = new ArrayList<>();
        order.add(current);
        seen.add(current.name());
        for (Namespace dependency : registry.dependenciesOf(current)) {
            if (seen.add(dependency.name())) {
                order.add(dependency);
            }
        }
        for (Namespace other : registry.namespaces()) {
            if (seen.add(other.name())) {
                order.add(other);
            }
        }
        return order;
    }
}
