package com.vidnyan.introspect.domain.subtype;

import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.NamespaceRegistry;
import com.vidnyan.introspect.domain.type.Identifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Walks the super-class chain and implemented-interface chains of a declaration.
 * Traversal is breadth-first, super type before interfaces, each ancestor visited once;
 * cycles in malformed input terminate.
 */
public final class Ancestry {

    private final NamespaceRegistry registry;

    public Ancestry(NamespaceRegistry registry) {
        this.registry = registry;
    }

    /**
     * Every resolvable ancestor of the class, nearest first. The class itself is excluded.
     */
    public List<BaseClass> ancestors(BaseClass cls) {
        List<BaseClass> result = new ArrayList<>();
        Set<Identifier> visited = new HashSet<>();
        visited.add(cls.getType());
        Deque<BaseClass> queue = new ArrayDeque<>();
        queue.add(cls);

        while (!queue.isEmpty()) {
            BaseClass current = queue.poll();
            for (Identifier parent : directParents(current)) {
                if (!visited.add(parent)) {
                    continue;
                }
                Optional<BaseClass> resolved = registry.findClass(parent);
                if (resolved.isPresent()) {
                    result.add(resolved.get());
                    queue.add(resolved.get());
                }
            }
        }
        return result;
    }

    /**
     * Whether any ancestor satisfies the predicate.
     */
    public boolean someAncestor(BaseClass cls, Predicate<BaseClass> predicate) {
        return ancestors(cls).stream().anyMatch(predicate);
    }

    /**
     * First non-empty result of the mapper over the ancestors, nearest first.
     */
    public <T> Optional<T> findAncestorMap(BaseClass cls, Function<BaseClass, Optional<T>> mapper) {
        for (BaseClass ancestor : ancestors(cls)) {
            Optional<T> result = mapper.apply(ancestor);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /**
     * Whether {@code child} transitively extends or implements {@code parent}.
     * Identity counts as a match.
     */
    public boolean extendsOrImplements(Identifier child, Identifier parent) {
        if (child.equals(parent)) {
            return true;
        }
        Set<Identifier> visited = new HashSet<>();
        Deque<Identifier> queue = new ArrayDeque<>();
        queue.add(child);
        while (!queue.isEmpty()) {
            Identifier current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            Optional<BaseClass> cls = registry.findClass(current);
            if (cls.isEmpty()) {
                continue;
            }
            for (Identifier next : directParents(cls.get())) {
                if (next.equals(parent)) {
                    return true;
                }
                queue.add(next);
            }
        }
        return false;
    }

    private static List<Identifier> directParents(BaseClass cls) {
        List<Identifier> parents = new ArrayList<>();
        cls.superIdentifier().ifPresent(parents::add);
        parents.addAll(cls.interfaceIdentifiers());
        return parents;
    }
}
