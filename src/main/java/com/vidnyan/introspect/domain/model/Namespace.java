package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.Identifier;
import com.vidnyan.introspect.domain.type.ScopedIdentifier;
import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.Builder;
import lombok.With;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Symbol table of one library at one version.
 * Every map is keyed by declaration name; insertion order is declaration order.
 * Immutable aggregate root: modifications return a new namespace.
 */
@With
@Builder(toBuilder = true)
public record Namespace(
    NamespaceKey key,
    List<NamespaceKey> dependencies,
    Map<String, BaseClass> classes,
    Map<String, EnumDeclaration> enums,
    Map<String, FunctionDeclaration> functions,
    Map<String, Constant> constants,
    Map<String, Callback> callbacks,
    Map<String, Alias> aliases,
    Set<String> knownConflicts
) {

    public Namespace {
        Objects.requireNonNull(key, "key");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        classes = freeze(classes);
        enums = freeze(enums);
        functions = freeze(functions);
        constants = freeze(constants);
        callbacks = freeze(callbacks);
        aliases = freeze(aliases);
        knownConflicts = knownConflicts == null ? Set.of() : Set.copyOf(knownConflicts);
    }

    private static <T> Map<String, T> freeze(Map<String, T> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public String name() {
        return key.name();
    }

    public String version() {
        return key.version();
    }

    /**
     * Find a class, interface or record by name.
     */
    public Optional<BaseClass> findClass(String className) {
        return Optional.ofNullable(classes.get(className));
    }

    /**
     * Find a declaration of the given kind, failing when absent or of another kind.
     */
    public BaseClass assertClass(String className, ClassKind kind) {
        BaseClass cls = classes.get(className);
        if (cls == null || cls.kind() != kind) {
            throw new IllegalArgumentException(
                    "No " + kind.name().toLowerCase() + " named " + className + " in " + key);
        }
        return cls;
    }

    public List<BaseClass> classesOfKind(ClassKind kind) {
        return classes.values().stream().filter(c -> c.kind() == kind).toList();
    }

    /**
     * Whether a top-level (non-nested) declaration with this name exists.
     */
    public boolean hasDeclaration(String declarationName) {
        return classes.containsKey(declarationName)
                || enums.containsKey(declarationName)
                || functions.containsKey(declarationName)
                || constants.containsKey(declarationName)
                || callbacks.containsKey(declarationName)
                || aliases.containsKey(declarationName);
    }

    /**
     * Whether a declaration usable as a type (class, enum, callback, alias) has this name.
     */
    public boolean hasTypeDeclaration(String declarationName) {
        return classes.containsKey(declarationName)
                || enums.containsKey(declarationName)
                || callbacks.containsKey(declarationName)
                || aliases.containsKey(declarationName);
    }

    /**
     * Find a type declaration by its native type name annotation.
     * Nested callbacks resolve to scoped identifiers.
     */
    public Optional<TypeExpression> findByCType(String cType) {
        if (cType == null || cType.isEmpty()) {
            return Optional.empty();
        }
        for (BaseClass cls : classes.values()) {
            if (cType.equals(cls.cType())) {
                return Optional.of(cls.getType());
            }
            for (Callback nested : cls.callbacks()) {
                if (cType.equals(nested.cType())) {
                    return Optional.of(new ScopedIdentifier(name(), cls.name(), nested.name()));
                }
            }
        }
        for (EnumDeclaration e : enums.values()) {
            if (cType.equals(e.cType())) {
                return Optional.of(new Identifier(name(), e.name()));
            }
        }
        for (Callback callback : callbacks.values()) {
            if (cType.equals(callback.cType())) {
                return Optional.of(new Identifier(name(), callback.name()));
            }
        }
        for (Alias alias : aliases.values()) {
            if (cType.equals(alias.cType())) {
                return Optional.of(new Identifier(name(), alias.name()));
            }
        }
        return Optional.empty();
    }

    /**
     * Copy with one class replaced (or added).
     */
    public Namespace withClass(BaseClass cls) {
        Map<String, BaseClass> updated = new LinkedHashMap<>(classes);
        updated.put(cls.name(), cls);
        return withClasses(updated);
    }

    public Stats stats() {
        return new Stats(
                classesOfKind(ClassKind.CLASS).size(),
                classesOfKind(ClassKind.INTERFACE).size(),
                classesOfKind(ClassKind.RECORD).size(),
                enums.size(),
                functions.size(),
                callbacks.size()
        );
    }

    public record Stats(int classCount, int interfaceCount, int recordCount, int enumCount,
                        int functionCount, int callbackCount) {}
}
