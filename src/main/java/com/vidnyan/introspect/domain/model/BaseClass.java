package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.GenerifiedType;
import com.vidnyan.introspect.domain.type.Identifier;
import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.Builder;
import lombok.With;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A class, interface or record, owned by exactly one namespace.
 * Tagged by {@link ClassKind}; all kinds share the same capability set.
 * Immutable: every modification returns a new instance.
 *
 * @param superType                 single parent (classes and records only), an {@link Identifier}
 *                                  or {@link GenerifiedType} once resolved, null when absent
 * @param implementedInterfaces     implemented interfaces; for interfaces, the interfaces they extend
 * @param virtualSignatureConflict  set by the conflict detector when an interface cannot inherit
 *                                  its parents' virtual contract
 */
@With
@Builder(toBuilder = true)
public record BaseClass(
    ClassKind kind,
    String namespace,
    String name,
    String cType,
    TypeExpression superType,
    List<TypeExpression> implementedInterfaces,
    List<Generic> generics,
    List<FunctionMember> constructors,
    List<FunctionMember> functions,
    List<Property> properties,
    List<Field> fields,
    List<Callback> callbacks,
    boolean virtualSignatureConflict
) {

    private static final String GENERIC_NAMES = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    public BaseClass {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
        if (kind == ClassKind.INTERFACE && superType != null) {
            throw new IllegalArgumentException("Interface " + namespace + "." + name + " cannot have a super type");
        }
        implementedInterfaces = copy(implementedInterfaces);
        generics = copy(generics);
        constructors = copy(constructors);
        functions = copy(functions);
        properties = copy(properties);
        fields = copy(fields);
        callbacks = copy(callbacks);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * Identifier referring to this declaration.
     */
    public Identifier getType() {
        return new Identifier(namespace, name);
    }

    public boolean isInterface() {
        return kind == ClassKind.INTERFACE;
    }

    public boolean isClass() {
        return kind == ClassKind.CLASS;
    }

    /**
     * The super type as a plain identifier, unwrapping generic instantiation.
     */
    public Optional<Identifier> superIdentifier() {
        if (superType instanceof Identifier identifier) {
            return Optional.of(identifier);
        }
        if (superType instanceof GenerifiedType generified) {
            return Optional.of(generified.base());
        }
        return Optional.empty();
    }

    /**
     * Implemented interfaces that are already resolved to identifiers.
     */
    public List<Identifier> interfaceIdentifiers() {
        List<Identifier> result = new ArrayList<>();
        for (TypeExpression type : implementedInterfaces) {
            if (type instanceof Identifier identifier) {
                result.add(identifier);
            } else if (type instanceof GenerifiedType generified) {
                result.add(generified.base());
            }
        }
        return result;
    }

    /**
     * Constructors, functions, properties and fields in declaration order.
     */
    public Stream<ClassMember> members() {
        return Stream.of(constructors.stream(), functions.stream(), properties.stream(), fields.stream())
                .flatMap(s -> s.map(ClassMember.class::cast));
    }

    /**
     * Constructors and functions sharing the given name.
     */
    public List<FunctionMember> functionsNamed(String memberName) {
        return Stream.concat(constructors.stream(), functions.stream())
                .filter(f -> f.name().equals(memberName))
                .toList();
    }

    public Optional<Callback> findCallback(String callbackName) {
        return callbacks.stream().filter(c -> c.name().equals(callbackName)).findFirst();
    }

    public Optional<Generic> findGeneric(String genericName) {
        return generics.stream().filter(g -> g.name().equals(genericName)).findFirst();
    }

    /**
     * Whether this class owns a nested declaration of the given name.
     */
    public boolean hasNested(String nestedName) {
        return findCallback(nestedName).isPresent();
    }

    /**
     * Append a generic parameter named after its position (A, B, C, ...).
     */
    public BaseClass addGeneric(TypeExpression constraint, TypeExpression defaultType) {
        if (generics.size() >= GENERIC_NAMES.length()) {
            throw new IllegalStateException("Too many generics on " + getType().display());
        }
        String genericName = String.valueOf(GENERIC_NAMES.charAt(generics.size()));
        List<Generic> updated = new ArrayList<>(generics);
        updated.add(new Generic(genericName, constraint, defaultType));
        return withGenerics(updated);
    }
}
