package com.vidnyan.introspect.domain.symbol;

import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticSink;
import com.vidnyan.introspect.domain.model.Alias;
import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.Callback;
import com.vidnyan.introspect.domain.model.ClassKind;
import com.vidnyan.introspect.domain.model.Constant;
import com.vidnyan.introspect.domain.model.Direction;
import com.vidnyan.introspect.domain.model.EnumDeclaration;
import com.vidnyan.introspect.domain.model.Field;
import com.vidnyan.introspect.domain.model.FunctionDeclaration;
import com.vidnyan.introspect.domain.model.FunctionKind;
import com.vidnyan.introspect.domain.model.FunctionMember;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.NamespaceKey;
import com.vidnyan.introspect.domain.model.Parameter;
import com.vidnyan.introspect.domain.model.Property;
import com.vidnyan.introspect.domain.raw.RawClass;
import com.vidnyan.introspect.domain.raw.RawFunction;
import com.vidnyan.introspect.domain.raw.RawNamespace;
import com.vidnyan.introspect.domain.raw.RawParameter;
import com.vidnyan.introspect.domain.raw.RawTypeRef;
import com.vidnyan.introspect.domain.type.AnyType;
import com.vidnyan.introspect.domain.type.ArrayType;
import com.vidnyan.introspect.domain.type.Identifier;
import com.vidnyan.introspect.domain.type.NullableType;
import com.vidnyan.introspect.domain.type.PrimitiveType;
import com.vidnyan.introspect.domain.type.TupleType;
import com.vidnyan.introspect.domain.type.TypeExpression;
import com.vidnyan.introspect.domain.type.UnionType;
import com.vidnyan.introspect.domain.type.UnresolvedReference;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds a namespace symbol table from its raw element tree.
 *
 * Every raw type reference becomes an {@link UnresolvedReference} leaf; structure
 * (arrays, tuples, unions, nullability) is kept. Virtual methods are named with the
 * {@value #VIRTUAL_PREFIX} prefix the scripting runtime uses for overridable hooks.
 */
@Slf4j
public class SymbolTableBuilder {

    public static final String VIRTUAL_PREFIX = "vfunc_";

    private final DiagnosticSink sink;

    public SymbolTableBuilder(DiagnosticSink sink) {
        this.sink = sink;
    }

    /**
     * Build the symbol table.
     *
     * @param knownConflicts member names pre-listed as problematic for this namespace
     */
    public Namespace build(RawNamespace raw, Set<String> knownConflicts) {
        NamespaceKey key = new NamespaceKey(raw.name(), raw.version());
        String ns = raw.name();

        Map<String, BaseClass> classes = new LinkedHashMap<>();
        addAll(key, classes, raw.classes(), c -> buildClass(ns, c, ClassKind.CLASS), RawClass::name);
        addAll(key, classes, raw.interfaces(), c -> buildClass(ns, c, ClassKind.INTERFACE), RawClass::name);
        addAll(key, classes, raw.records(), c -> buildClass(ns, c, ClassKind.RECORD), RawClass::name);

        Map<String, EnumDeclaration> enums = new LinkedHashMap<>();
        addAll(key, enums, raw.enums(),
                e -> new EnumDeclaration(e.name(), e.cType(), e.members(), e.flags()),
                RawNamespace.RawEnum::name);

        Map<String, FunctionDeclaration> functions = new LinkedHashMap<>();
        addAll(key, functions, raw.functions(),
                f -> new FunctionDeclaration(f.name(), f.cType(), parameters(ns, f), returnType(ns, f.returnType())),
                RawFunction::name);

        Map<String, Callback> callbacks = new LinkedHashMap<>();
        addAll(key, callbacks, raw.callbacks(), f -> callback(ns, f), RawFunction::name);

        Map<String, Constant> constants = new LinkedHashMap<>();
        addAll(key, constants, raw.constants(),
                c -> new Constant(c.name(), c.cType(), type(ns, c.type()), c.value()),
                RawNamespace.RawConstant::name);

        Map<String, Alias> aliases = new LinkedHashMap<>();
        addAll(key, aliases, raw.aliases(),
                a -> new Alias(a.name(), a.cType(), type(ns, a.target())),
                RawNamespace.RawAlias::name);

        List<NamespaceKey> dependencies = raw.includes().stream()
                .map(i -> new NamespaceKey(i.name(), i.version()))
                .toList();

        Namespace namespace = Namespace.builder()
                .key(key)
                .dependencies(dependencies)
                .classes(classes)
                .enums(enums)
                .functions(functions)
                .callbacks(callbacks)
                .constants(constants)
                .aliases(aliases)
                .knownConflicts(knownConflicts)
                .build();

        log.debug("Built symbol table {}: {}", key, namespace.stats());
        return namespace;
    }

    private <R, T> void addAll(NamespaceKey key, Map<String, T> target, List<R> elements,
                               Function<R, T> factory, Function<R, String> nameOf) {
        for (R element : elements) {
            String name = nameOf.apply(element);
            if (name == null || name.isBlank()) {
                continue;
            }
            if (target.containsKey(name)) {
                sink.report(Diagnostic.builder(DiagnosticKind.DUPLICATE_DECLARATION)
                        .namespace(key.packageName())
                        .subject(name)
                        .message("Duplicate declaration ignored")
                        .build());
                continue;
            }
            target.put(name, factory.apply(element));
        }
    }

    private BaseClass buildClass(String ns, RawClass raw, ClassKind kind) {
        Identifier self = new Identifier(ns, raw.name());

        List<FunctionMember> constructors = raw.constructors().stream()
                .map(f -> FunctionMember.of(f.name(), FunctionKind.CONSTRUCTOR, parameters(ns, f),
                        f.returnType() == null ? self : type(ns, f.returnType())))
                .toList();

        List<FunctionMember> functions = new ArrayList<>();
        raw.methods().forEach(f -> functions.add(member(ns, f, f.name(), FunctionKind.REGULAR)));
        raw.staticMethods().forEach(f -> functions.add(member(ns, f, f.name(), FunctionKind.STATIC)));
        raw.virtualMethods().forEach(f -> functions.add(member(ns, f, virtualName(f.name()), FunctionKind.VIRTUAL)));

        List<Property> properties = raw.properties().stream()
                .map(p -> new Property(p.name(), type(ns, p.type()),
                        !Boolean.FALSE.equals(p.readable()), !Boolean.FALSE.equals(p.writable())))
                .toList();

        List<Field> fields = raw.fields().stream()
                .map(f -> new Field(f.name(), type(ns, f.type()), !Boolean.FALSE.equals(f.writable())))
                .toList();

        TypeExpression superType = null;
        if (kind != ClassKind.INTERFACE && raw.parent() != null && !raw.parent().isBlank()) {
            superType = new UnresolvedReference(ns, raw.parent(), null);
        }

        return BaseClass.builder()
                .kind(kind)
                .namespace(ns)
                .name(raw.name())
                .cType(raw.cType())
                .superType(superType)
                .implementedInterfaces(raw.interfaces().stream()
                        .map(i -> (TypeExpression) new UnresolvedReference(ns, i, null))
                        .toList())
                .constructors(constructors)
                .functions(functions)
                .properties(properties)
                .fields(fields)
                .callbacks(raw.callbacks().stream().map(c -> callback(ns, c)).toList())
                .build();
    }

    private static String virtualName(String name) {
        return name.startsWith(VIRTUAL_PREFIX) ? name : VIRTUAL_PREFIX + name;
    }

    private FunctionMember member(String ns, RawFunction raw, String name, FunctionKind kind) {
        return FunctionMember.of(name, kind, parameters(ns, raw), returnType(ns, raw.returnType()));
    }

    private Callback callback(String ns, RawFunction raw) {
        return new Callback(raw.name(), raw.cType(), parameters(ns, raw), returnType(ns, raw.returnType()));
    }

    private List<Parameter> parameters(String ns, RawFunction raw) {
        return raw.parameters().stream()
                .map(p -> parameter(ns, p))
                .toList();
    }

    private Parameter parameter(String ns, RawParameter raw) {
        return new Parameter(raw.name(), type(ns, raw.type()), direction(raw.direction()), raw.varArgs());
    }

    private static Direction direction(String raw) {
        if (raw == null) {
            return Direction.IN;
        }
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "out" -> Direction.OUT;
            case "inout" -> Direction.INOUT;
            default -> Direction.IN;
        };
    }

    private TypeExpression returnType(String ns, RawTypeRef raw) {
        return raw == null ? PrimitiveType.VOID : type(ns, raw);
    }

    /**
     * Convert a raw reference into a type expression with unresolved leaves.
     */
    TypeExpression type(String ns, RawTypeRef raw) {
        if (raw == null) {
            return AnyType.INSTANCE;
        }
        TypeExpression base;
        if (!raw.members().isEmpty()) {
            base = UnionType.of(raw.members().stream().map(m -> type(ns, m)).toList());
        } else if (!raw.elements().isEmpty()) {
            base = new TupleType(raw.elements().stream().map(e -> type(ns, e)).toList());
        } else if (raw.name() == null || raw.name().isBlank()) {
            base = AnyType.INSTANCE;
        } else {
            base = new UnresolvedReference(ns, raw.name(), raw.cType());
        }
        if (raw.arrayDepth() > 0) {
            base = new ArrayType(base, raw.arrayDepth());
        }
        return raw.nullable() ? NullableType.of(base) : base;
    }
}
