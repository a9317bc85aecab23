package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.Identifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The participating namespaces of a run, in load order.
 * At most one version per namespace name takes part in a run, so lookups are by name.
 * Immutable and thread-safe.
 */
public final class NamespaceRegistry {

    private final Map<String, Namespace> byName;

    private NamespaceRegistry(Map<String, Namespace> byName) {
        this.byName = Collections.unmodifiableMap(byName);
    }

    /**
     * Build a registry; later namespaces with an already registered name are rejected.
     */
    public static NamespaceRegistry of(List<Namespace> namespaces) {
        Map<String, Namespace> byName = new LinkedHashMap<>();
        for (Namespace namespace : namespaces) {
            Namespace previous = byName.putIfAbsent(namespace.name(), namespace);
            if (previous != null) {
                throw new IllegalArgumentException("Namespace " + namespace.name()
                        + " registered twice: " + previous.key() + " and " + namespace.key());
            }
        }
        return new NamespaceRegistry(byName);
    }

    public static NamespaceRegistry of(Namespace... namespaces) {
        return of(List.of(namespaces));
    }

    public Optional<Namespace> find(String namespaceName) {
        return Optional.ofNullable(byName.get(namespaceName));
    }

    public boolean contains(String namespaceName) {
        return byName.containsKey(namespaceName);
    }

    /**
     * Resolve an identifier to its class, interface or record declaration.
     */
    public Optional<BaseClass> findClass(Identifier identifier) {
        return find(identifier.namespace()).flatMap(ns -> ns.findClass(identifier.name()));
    }

    /**
     * The dependency namespaces of the given namespace that take part in this run.
     */
    public List<Namespace> dependenciesOf(Namespace namespace) {
        List<Namespace> result = new ArrayList<>();
        for (NamespaceKey dependency : namespace.dependencies()) {
            find(dependency.name()).ifPresent(result::add);
        }
        return result;
    }

    /**
     * All namespaces in load order.
     */
    public List<Namespace> namespaces() {
        return List.copyOf(byName.values());
    }

    /**
     * Copy with one namespace replaced, keeping its position.
     */
    public NamespaceRegistry with(Namespace namespace) {
        Map<String, Namespace> updated = new LinkedHashMap<>(byName);
        updated.put(namespace.name(), namespace);
        return new NamespaceRegistry(updated);
    }

    public int size() {
        return byName.size();
    }
}
