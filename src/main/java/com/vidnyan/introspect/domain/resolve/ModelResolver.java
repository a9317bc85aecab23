package com.vidnyan.introspect.domain.resolve;

import com.vidnyan.introspect.domain.diagnostic.DiagnosticSink;
import com.vidnyan.introspect.domain.model.Alias;
import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.Callback;
import com.vidnyan.introspect.domain.model.Constant;
import com.vidnyan.introspect.domain.model.FunctionDeclaration;
import com.vidnyan.introspect.domain.model.FunctionMember;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.NamespaceRegistry;
import com.vidnyan.introspect.domain.model.Parameter;
import com.vidnyan.introspect.domain.type.GenerifiedType;
import com.vidnyan.introspect.domain.type.Identifier;
import com.vidnyan.introspect.domain.type.TypeExpression;
import com.vidnyan.introspect.domain.type.TypeExpressions;
import com.vidnyan.introspect.domain.type.UnresolvedReference;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Replaces every {@link UnresolvedReference} of a namespace with a concrete type.
 * Produces a new namespace; the input is left untouched.
 */
@Slf4j
public class ModelResolver {

    private final TypeResolver resolver;
    private final DiagnosticSink sink;

    public ModelResolver(NamespaceRegistry registry, DiagnosticSink sink) {
        this.resolver = new TypeResolver(registry);
        this.sink = sink;
    }

    /**
     * Resolve every namespace of the registry, returning a registry of resolved namespaces.
     */
    public static NamespaceRegistry resolveAll(NamespaceRegistry registry, DiagnosticSink sink) {
        ModelResolver modelResolver = new ModelResolver(registry, sink);
        List<Namespace> resolved = registry.namespaces().stream()
                .map(modelResolver::resolve)
                .toList();
        return NamespaceRegistry.of(resolved);
    }

    public Namespace resolve(Namespace namespace) {
        ResolutionContext root = ResolutionContext.of(namespace);
        AtomicInteger fallbacks = new AtomicInteger();

        Map<String, BaseClass> classes = new LinkedHashMap<>();
        namespace.classes().forEach((name, cls) -> classes.put(name, resolveClass(cls, root.withContainer(name), fallbacks)));

        Map<String, FunctionDeclaration> functions = new LinkedHashMap<>();
        namespace.functions().forEach((name, f) -> {
            ResolutionContext ctx = root.withSubject(name);
            functions.put(name, f.withParameters(resolveParameters(f.parameters(), ctx, fallbacks))
                    .withReturnType(resolveType(f.returnType(), ctx, fallbacks)));
        });

        Map<String, Callback> callbacks = new LinkedHashMap<>();
        namespace.callbacks().forEach((name, cb) -> callbacks.put(name, resolveCallback(cb, root.withSubject(name), fallbacks)));

        Map<String, Constant> constants = new LinkedHashMap<>();
        namespace.constants().forEach((name, c) -> constants.put(name, c.withType(resolveType(c.type(), root.withSubject(name), fallbacks))));

        Map<String, Alias> aliases = new LinkedHashMap<>();
        namespace.aliases().forEach((name, a) -> aliases.put(name, a.withTarget(resolveType(a.target(), root.withSubject(name), fallbacks))));

        log.debug("Resolved {} ({} fallbacks)", namespace.key(), fallbacks.get());
        return namespace.toBuilder()
                .classes(classes)
                .functions(functions)
                .callbacks(callbacks)
                .constants(constants)
                .aliases(aliases)
                .build();
    }

    private BaseClass resolveClass(BaseClass cls, ResolutionContext ctx, AtomicInteger fallbacks) {
        TypeExpression superType = null;
        if (cls.superType() != null) {
            TypeExpression resolved = resolveType(cls.superType(), ctx.withSubject(cls.name() + " (parent)"), fallbacks);
            // only declarations can be extended; a fallback drops the parent
            if (resolved instanceof Identifier || resolved instanceof GenerifiedType) {
                superType = resolved;
            }
        }

        List<TypeExpression> interfaces = new ArrayList<>();
        for (TypeExpression iface : cls.implementedInterfaces()) {
            TypeExpression resolved = resolveType(iface, ctx.withSubject(cls.name() + " (implements)"), fallbacks);
            if (resolved instanceof Identifier || resolved instanceof GenerifiedType) {
                interfaces.add(resolved);
            }
        }

        return cls.toBuilder()
                .superType(superType)
                .implementedInterfaces(interfaces)
                .constructors(resolveFunctions(cls.constructors(), ctx, fallbacks))
                .functions(resolveFunctions(cls.functions(), ctx, fallbacks))
                .properties(cls.properties().stream()
                        .map(p -> p.withType(resolveType(p.type(), subject(ctx, p.name()), fallbacks)))
                        .toList())
                .fields(cls.fields().stream()
                        .map(f -> f.withType(resolveType(f.type(), subject(ctx, f.name()), fallbacks)))
                        .toList())
                .callbacks(cls.callbacks().stream()
                        .map(cb -> resolveCallback(cb, subject(ctx, cb.name()), fallbacks))
                        .toList())
                .build();
    }

    private static ResolutionContext subject(ResolutionContext ctx, String member) {
        return ctx.withSubject(ctx.container() + "." + member);
    }

    private List<FunctionMember> resolveFunctions(List<FunctionMember> functions, ResolutionContext ctx, AtomicInteger fallbacks) {
        return functions.stream()
                .map(f -> {
                    ResolutionContext memberCtx = subject(ctx, f.name());
                    return f.withParameters(resolveParameters(f.parameters(), memberCtx, fallbacks))
                            .withReturnType(resolveType(f.returnType(), memberCtx, fallbacks));
                })
                .toList();
    }

    private Callback resolveCallback(Callback callback, ResolutionContext ctx, AtomicInteger fallbacks) {
        return callback.withParameters(resolveParameters(callback.parameters(), ctx, fallbacks))
                .withReturnType(resolveType(callback.returnType(), ctx, fallbacks));
    }

    private List<Parameter> resolveParameters(List<Parameter> parameters, ResolutionContext ctx, AtomicInteger fallbacks) {
        return parameters.stream()
                .map(p -> p.withType(resolveType(p.type(), ctx.withSubject(ctx.subject() + "(" + p.name() + ")"), fallbacks)))
                .toList();
    }

    /**
     * Resolve every unresolved leaf of a type expression.
     */
    TypeExpression resolveType(TypeExpression type, ResolutionContext ctx, AtomicInteger fallbacks) {
        if (!TypeExpressions.containsUnresolved(type)) {
            return type;
        }
        return TypeExpressions.mapLeaves(type, leaf -> {
            if (!(leaf instanceof UnresolvedReference unresolved)) {
                return leaf;
            }
            Resolution resolution = resolver.resolve(unresolved.reference(), unresolved.cType(), ctx);
            resolution.diagnostic().ifPresent(sink::report);
            if (resolution instanceof Resolution.Fallback) {
                fallbacks.incrementAndGet();
            }
            return resolution.type();
        });
    }
}
