package com.vidnyan.introspect.domain.conflict;

import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticSink;
import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.ClassMember;
import com.vidnyan.introspect.domain.model.Direction;
import com.vidnyan.introspect.domain.model.Field;
import com.vidnyan.introspect.domain.model.FunctionMember;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.NamespaceRegistry;
import com.vidnyan.introspect.domain.model.Parameter;
import com.vidnyan.introspect.domain.model.Property;
import com.vidnyan.introspect.domain.subtype.Ancestry;
import com.vidnyan.introspect.domain.subtype.SubtypeChecker;
import com.vidnyan.introspect.domain.type.AnyType;
import com.vidnyan.introspect.domain.type.ArrayType;
import com.vidnyan.introspect.domain.type.ConflictMarker;
import com.vidnyan.introspect.domain.type.Identifier;
import com.vidnyan.introspect.domain.type.NeverType;
import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies member overrides across the inheritance and interface chains of a declaration
 * and rewrites the declaration accordingly.
 *
 * <p>Per member and per colliding ancestor the first applicable rule wins; across ancestors
 * the most severe kind is kept. The input is never modified: annotating the same model twice
 * yields equal results. Synthetic members are ignored and conflict markers are unwrapped
 * before any comparison.</p>
 */
@Slf4j
public class ConflictDetector {

    public static final Identifier DEFAULT_UNIVERSAL_BASE = new Identifier("GObject", "Object");
    public static final Set<String> DEFAULT_RESERVED_METHODS = Set.of("connect", "connect_after", "emit");

    private final Identifier universalBaseType;
    private final Set<String> reservedMethods;
    private final DiagnosticSink sink;

    public ConflictDetector(Identifier universalBaseType, Set<String> reservedMethods, DiagnosticSink sink) {
        this.universalBaseType = universalBaseType;
        this.reservedMethods = Set.copyOf(reservedMethods);
        this.sink = sink;
    }

    public static ConflictDetector withDefaults(DiagnosticSink sink) {
        return new ConflictDetector(DEFAULT_UNIVERSAL_BASE, DEFAULT_RESERVED_METHODS, sink);
    }

    /**
     * Annotate every declaration of a namespace against the given registry.
     */
    public NamespaceAnnotation annotateNamespace(NamespaceRegistry registry, Namespace namespace) {
        Map<String, BaseClass> classes = new LinkedHashMap<>();
        List<ConflictRecord> records = new ArrayList<>();
        for (BaseClass cls : namespace.classes().values()) {
            ClassAnnotation annotation = annotate(registry, cls);
            classes.put(cls.name(), annotation.annotated());
            records.addAll(annotation.records());
        }
        log.debug("Annotated {} declarations of {}: {} conflicts", classes.size(), namespace.key(), records.size());
        return new NamespaceAnnotation(namespace.withClasses(classes), records);
    }

    /**
     * Whether the interface cannot inherit the virtual contract of its parents as-is.
     */
    public boolean hasVirtualSignatureConflicts(NamespaceRegistry registry, BaseClass iface) {
        if (!iface.isInterface()) {
            return false;
        }
        Ancestry ancestry = new Ancestry(registry);
        SubtypeChecker checker = new SubtypeChecker(registry);
        List<BaseClass> ancestors = ancestry.ancestors(iface);
        return iface.functions().stream()
                .filter(f -> !f.synthetic() && f.isVirtual())
                .anyMatch(f -> ancestors.stream().anyMatch(a -> virtualCollision(checker, iface, f, a)));
    }

    /**
     * Classify every member of the declaration and produce its annotated copy.
     */
    public ClassAnnotation annotate(NamespaceRegistry registry, BaseClass cls) {
        Ancestry ancestry = new Ancestry(registry);
        SubtypeChecker checker = new SubtypeChecker(registry);
        List<BaseClass> ancestors = ancestry.ancestors(cls);
        Set<String> known = registry.find(cls.namespace()).map(Namespace::knownConflicts).orElse(Set.of());
        boolean rootedAtUniversalBase = ancestors.stream().anyMatch(a -> a.getType().equals(universalBaseType));

        List<ConflictRecord> records = new ArrayList<>();

        List<Field> fields = new ArrayList<>();
        for (Field field : cls.fields()) {
            Classification found = classifyField(checker, cls, field, ancestors, known);
            if (found == null) {
                fields.add(field);
                continue;
            }
            fields.add(field.withType(ConflictMarker.wrap(field.type(), found.kind())));
            records.add(record(cls, field, found, ConflictResolution.WRAP_TYPE));
        }

        List<Property> properties = new ArrayList<>();
        for (Property property : cls.properties()) {
            Classification found = classifyProperty(checker, cls, property, ancestors, known);
            if (found == null) {
                properties.add(property);
                continue;
            }
            properties.add(property.withType(ConflictMarker.wrap(property.type(), found.kind())));
            records.add(record(cls, property, found, ConflictResolution.WRAP_TYPE));
        }

        boolean virtualSignatureConflict = false;
        List<List<FunctionMember>> functionLists = new ArrayList<>();
        for (List<FunctionMember> source : List.of(cls.constructors(), cls.functions())) {
            List<FunctionMember> annotated = new ArrayList<>();
            for (FunctionMember function : source) {
                if (function.synthetic()) {
                    // regenerated below when still needed
                    continue;
                }
                boolean reserved = rootedAtUniversalBase && !function.isConstructor()
                        && reservedMethods.contains(function.name());
                FunctionOutcome outcome = classifyFunction(checker, ancestry, cls, function, ancestors,
                        reserved || known.contains(function.name()));
                if (outcome == null) {
                    annotated.add(function);
                    continue;
                }
                records.add(record(cls, function, outcome.classification(), outcome.resolution()));
                switch (outcome.resolution()) {
                    case OMIT -> reportOmitted(cls, function, outcome.classification());
                    case EMIT_OVERLOADS -> {
                        annotated.add(function.withOverloadTag(true));
                        virtualSignatureConflict = true;
                    }
                    case KEEP_WITH_NEVER_OVERLOAD -> {
                        annotated.add(function);
                        annotated.add(neverOverload(function, outcome.classification().ancestor(), cls));
                    }
                    case WRAP_TYPE -> annotated.add(function);
                }
            }
            functionLists.add(annotated);
        }

        records.forEach(this::reportConflict);

        BaseClass annotated = cls.toBuilder()
                .fields(fields)
                .properties(properties)
                .constructors(functionLists.get(0))
                .functions(functionLists.get(1))
                .virtualSignatureConflict(cls.virtualSignatureConflict() || virtualSignatureConflict)
                .build();
        return new ClassAnnotation(annotated, records);
    }

    private Classification classifyField(SubtypeChecker checker, BaseClass cls, Field field,
                                         List<BaseClass> ancestors, Set<String> known) {
        Classification best = null;
        for (BaseClass ancestor : ancestors) {
            ConflictKind kind = null;
            Optional<Field> parentField = findField(ancestor, field.name());
            Optional<Property> parentProperty = findProperty(ancestor, field.name());
            if (parentField.isPresent()) {
                if (!compatible(checker, cls, ancestor, field.type(), parentField.get().type())) {
                    kind = ConflictKind.FIELD_NAME_CONFLICT;
                }
            } else if (parentProperty.isPresent()) {
                kind = ConflictKind.ACCESSOR_PROPERTY_CONFLICT;
            } else if (!realFunctions(ancestor, field.name()).isEmpty()) {
                kind = ConflictKind.FUNCTION_NAME_CONFLICT;
            }
            best = Classification.keepMostSevere(best, kind, ancestor.getType());
        }
        if (known.contains(field.name())) {
            best = Classification.keepMostSevere(best, ConflictKind.FIELD_NAME_CONFLICT, null);
        }
        return best;
    }

    private Classification classifyProperty(SubtypeChecker checker, BaseClass cls, Property property,
                                            List<BaseClass> ancestors, Set<String> known) {
        Classification best = null;
        for (BaseClass ancestor : ancestors) {
            ConflictKind kind = null;
            Optional<Property> parentProperty = findProperty(ancestor, property.name());
            if (findField(ancestor, property.name()).isPresent()) {
                kind = ConflictKind.ACCESSOR_PROPERTY_CONFLICT;
            } else if (parentProperty.isPresent()) {
                if (!compatible(checker, cls, ancestor, property.type(), parentProperty.get().type())) {
                    kind = ConflictKind.PROPERTY_NAME_CONFLICT;
                }
            } else if (!realFunctions(ancestor, property.name()).isEmpty()) {
                kind = ConflictKind.FUNCTION_NAME_CONFLICT;
            }
            best = Classification.keepMostSevere(best, kind, ancestor.getType());
        }
        if (known.contains(property.name())) {
            best = Classification.keepMostSevere(best, ConflictKind.PROPERTY_NAME_CONFLICT, null);
        }
        return best;
    }

    private FunctionOutcome classifyFunction(SubtypeChecker checker, Ancestry ancestry, BaseClass cls,
                                             FunctionMember function, List<BaseClass> ancestors, boolean forced) {
        Classification best = null;
        List<Collision> collisions = new ArrayList<>();
        Identifier shadowedAccessor = null;

        for (BaseClass ancestor : ancestors) {
            ConflictKind kind = null;
            if (cls.isInterface() && function.isVirtual() && virtualCollision(checker, cls, function, ancestor)) {
                kind = ConflictKind.VFUNC_SIGNATURE_CONFLICT;
            } else {
                for (FunctionMember parent : realFunctions(ancestor, function.name())) {
                    if (isConflictingFunction(checker, cls.getType(), ancestor.getType(), function, parent)) {
                        kind = ConflictKind.FUNCTION_NAME_CONFLICT;
                        collisions.add(new Collision(ancestor, parent));
                    }
                }
            }
            if (kind == null && shadowedAccessor == null && hasAccessor(ancestor, function.name())) {
                shadowedAccessor = ancestor.getType();
            }
            best = Classification.keepMostSevere(best, kind, ancestor.getType());
        }
        if (forced) {
            best = Classification.keepMostSevere(best, ConflictKind.FUNCTION_NAME_CONFLICT, null);
        }

        if (best == null) {
            if (shadowedAccessor == null && hasAccessor(cls, function.name())) {
                shadowedAccessor = cls.getType();
            }
            if (shadowedAccessor != null) {
                return new FunctionOutcome(
                        new Classification(ConflictKind.FUNCTION_NAME_CONFLICT, shadowedAccessor),
                        ConflictResolution.OMIT);
            }
            return null;
        }

        return switch (best.kind()) {
            case VFUNC_SIGNATURE_CONFLICT -> new FunctionOutcome(best, ConflictResolution.EMIT_OVERLOADS);
            case FUNCTION_NAME_CONFLICT -> {
                boolean inheritedOnly = !forced && !collisions.isEmpty()
                        && collisions.stream().allMatch(c -> isInherited(checker, ancestry, c, ancestors));
                yield new FunctionOutcome(best, inheritedOnly
                        ? ConflictResolution.OMIT
                        : ConflictResolution.KEEP_WITH_NEVER_OVERLOAD);
            }
            default -> new FunctionOutcome(best, ConflictResolution.WRAP_TYPE);
        };
    }

    /**
     * A collision with {@code collision.ancestor()} is inherited when some other ancestor
     * below it already redeclares a conflicting override of the same function.
     */
    private boolean isInherited(SubtypeChecker checker, Ancestry ancestry, Collision collision,
                                List<BaseClass> ancestors) {
        Identifier colliding = collision.ancestor().getType();
        for (BaseClass other : ancestors) {
            if (other.getType().equals(colliding)
                    || !ancestry.extendsOrImplements(other.getType(), colliding)) {
                continue;
            }
            for (FunctionMember redeclared : realFunctions(other, collision.parent().name())) {
                if (isConflictingFunction(checker, other.getType(), colliding, redeclared, collision.parent())) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean virtualCollision(SubtypeChecker checker, BaseClass cls, FunctionMember function, BaseClass ancestor) {
        return realFunctions(ancestor, function.name()).stream()
                .filter(FunctionMember::isVirtual)
                .anyMatch(parent -> !sameSignature(function, parent)
                        || isConflictingFunction(checker, cls.getType(), ancestor.getType(), function, parent));
    }

    /**
     * Override compatibility of two functions. Parameters are compared in the same direction
     * as the return type.
     */
    boolean isConflictingFunction(SubtypeChecker checker, Identifier childScope, Identifier parentScope,
                                  FunctionMember child, FunctionMember parent) {
        if (child.isConstructor() != parent.isConstructor()) {
            return true;
        }
        if (child.kind() != parent.kind()) {
            return false;
        }

        List<Parameter> childInputs = child.inputParameters();
        List<Parameter> parentInputs = parent.inputParameters();
        if (childInputs.size() > parentInputs.size()) {
            return true;
        }
        if (!compatible(checker, childScope, parentScope, child.returnType(), parent.returnType())) {
            return true;
        }
        for (int i = 0; i < childInputs.size(); i++) {
            if (!compatible(checker, childScope, parentScope, childInputs.get(i).type(), parentInputs.get(i).type())) {
                return true;
            }
        }

        List<Parameter> childOutputs = child.outputParameters();
        List<Parameter> parentOutputs = parent.outputParameters();
        if (childOutputs.size() != parentOutputs.size()) {
            return true;
        }
        for (int i = 0; i < childOutputs.size(); i++) {
            if (!compatible(checker, childScope, parentScope, childOutputs.get(i).type(), parentOutputs.get(i).type())) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameSignature(FunctionMember child, FunctionMember parent) {
        if (!ConflictMarker.unwrap(child.returnType()).equals(ConflictMarker.unwrap(parent.returnType()))) {
            return false;
        }
        List<Parameter> childParams = child.parameters();
        List<Parameter> parentParams = parent.parameters();
        if (childParams.size() != parentParams.size()) {
            return false;
        }
        for (int i = 0; i < childParams.size(); i++) {
            Parameter c = childParams.get(i);
            Parameter p = parentParams.get(i);
            if (c.direction() != p.direction()
                    || !ConflictMarker.unwrap(c.type()).equals(ConflictMarker.unwrap(p.type()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean compatible(SubtypeChecker checker, BaseClass cls, BaseClass ancestor,
                                      TypeExpression child, TypeExpression parent) {
        return compatible(checker, cls.getType(), ancestor.getType(), child, parent);
    }

    private static boolean compatible(SubtypeChecker checker, Identifier childScope, Identifier parentScope,
                                      TypeExpression child, TypeExpression parent) {
        return checker.isSubtypeOf(childScope, parentScope,
                ConflictMarker.unwrap(child), ConflictMarker.unwrap(parent));
    }

    private static List<FunctionMember> realFunctions(BaseClass cls, String name) {
        return cls.functionsNamed(name).stream()
                .filter(f -> !f.synthetic())
                .toList();
    }

    private static Optional<Field> findField(BaseClass cls, String name) {
        return cls.fields().stream().filter(f -> f.name().equals(name)).findFirst();
    }

    private static Optional<Property> findProperty(BaseClass cls, String name) {
        return cls.properties().stream().filter(p -> p.name().equals(name)).findFirst();
    }

    private static boolean hasAccessor(BaseClass cls, String name) {
        return findField(cls, name).isPresent() || findProperty(cls, name).isPresent();
    }

    /**
     * Trailing {@code name(...args: never[]): any} overload that keeps the declaration
     * assignable to the colliding ancestor.
     */
    private static FunctionMember neverOverload(FunctionMember function, Identifier ancestor, BaseClass cls) {
        Identifier owner = ancestor == null ? cls.getType() : ancestor;
        return FunctionMember.builder()
                .name(function.name())
                .kind(function.kind())
                .parameters(List.of(new Parameter("args", ArrayType.of(NeverType.INSTANCE), Direction.IN, true)))
                .returnType(AnyType.INSTANCE)
                .synthetic(true)
                .warning("Conflicted with " + owner.qualifiedName() + "." + function.name())
                .build();
    }

    private static ConflictRecord record(BaseClass cls, ClassMember member, Classification classification,
                                         ConflictResolution resolution) {
        return new ConflictRecord(cls.getType(), member.name(), member.memberKind(),
                classification.kind(), resolution, classification.ancestor());
    }

    private void reportConflict(ConflictRecord record) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("member", record.member());
        attributes.put("kind", record.kind().name());
        attributes.put("resolution", record.resolution().name());
        if (record.ancestor() != null) {
            attributes.put("ancestor", record.ancestor().qualifiedName());
        }
        sink.report(Diagnostic.builder(DiagnosticKind.CONFLICT)
                .namespace(record.owner().namespace())
                .subject(record.subject())
                .message(String.format("%s %s with %s, resolved as %s",
                        record.memberKind().name().toLowerCase(), record.kind(),
                        record.isForced() ? "forced list" : record.ancestor().qualifiedName(),
                        record.resolution()))
                .attributes(attributes)
                .build());
    }

    private void reportOmitted(BaseClass cls, FunctionMember function, Classification classification) {
        sink.report(Diagnostic.builder(DiagnosticKind.OMITTED_MEMBER)
                .namespace(cls.namespace())
                .subject(cls.name() + "." + function.name())
                .message("Omitted " + function.signature() + " colliding with "
                        + classification.ancestor().qualifiedName())
                .attributes(Map.of("member", function.name()))
                .build());
    }

    private record Classification(ConflictKind kind, Identifier ancestor) {

        static Classification keepMostSevere(Classification current, ConflictKind kind, Identifier ancestor) {
            if (kind == null) {
                return current;
            }
            if (current == null || kind.isMoreSevereThan(current.kind())) {
                return new Classification(kind, ancestor);
            }
            return current;
        }
    }

    private record Collision(BaseClass ancestor, FunctionMember parent) {}

    private record FunctionOutcome(Classification classification, ConflictResolution resolution) {}
}
