package com.vidnyan.introspect.domain.module;

import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticSink;
import com.vidnyan.introspect.domain.model.NamespaceKey;
import com.vidnyan.introspect.domain.raw.ElementTreeReadException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Selects the modules of a run: matches requested patterns against the discovered modules,
 * groups them by namespace, disambiguates versions, pulls in transitive dependencies and
 * orders the result dependencies first.
 */
@Slf4j
public class ModuleLoader {

    private final VersionPolicy policy;
    private final DiagnosticSink sink;

    public ModuleLoader(VersionPolicy policy, DiagnosticSink sink) {
        this.policy = policy == null ? VersionPolicy.NONE : policy;
        this.sink = sink;
    }

    /**
     * Build the load plan.
     *
     * @param requested    module patterns
     * @param ignore       package names ({@code Name-Version}) excluded from discovery
     * @param available    every module found in the search locations, in search order
     * @param dependencies reads the declared dependencies of a selected module
     * @throws ModuleCycleException when the selected modules depend on each other in a cycle
     */
    public LoadPlan load(List<String> requested, Set<String> ignore, List<ModuleFile> available,
                         ModuleDependencies dependencies) {
        List<ModuleFile> candidates = candidates(available, ignore);
        List<ModulePattern> patterns = requested.stream().map(ModulePattern::parse).toList();
        Set<String> failed = new LinkedHashSet<>();

        // Match requested patterns
        Map<String, List<ModuleFile>> matched = new TreeMap<>();
        for (ModulePattern pattern : patterns) {
            List<ModuleFile> hits = candidates.stream().filter(pattern::matches).toList();
            if (hits.isEmpty()) {
                failed.add(pattern.toString());
                report(DiagnosticKind.MODULE_FAILED, pattern.toString(), "No module matches " + pattern);
                continue;
            }
            for (ModuleFile hit : hits) {
                List<ModuleFile> group = matched.computeIfAbsent(hit.namespace(), k -> new ArrayList<>());
                if (!group.contains(hit)) {
                    group.add(hit);
                }
            }
        }

        // Group and disambiguate
        Map<String, ModuleGroup> groups = new TreeMap<>();
        matched.forEach((namespace, modules) ->
                groups.put(namespace, decide(ModuleGroup.grouped(namespace, modules), patterns)));

        // Transitive dependencies
        Map<String, List<NamespaceKey>> dependencyKeys = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>(groups.keySet());
        while (!queue.isEmpty()) {
            String namespace = queue.poll();
            ModuleGroup group = groups.get(namespace);
            if (group.state() != ModuleState.RESOLVED || dependencyKeys.containsKey(namespace)) {
                continue;
            }
            List<NamespaceKey> keys;
            try {
                keys = dependencies.dependenciesOf(group.selected());
            } catch (ElementTreeReadException e) {
                groups.put(namespace, group.failed());
                failed.add(group.selected().packageName());
                report(DiagnosticKind.READ_FAILED, group.selected().packageName(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                log.error("Failed to read dependencies of {}", group.selected().packageName(), e);
                groups.put(namespace, group.failed());
                failed.add(group.selected().packageName());
                report(DiagnosticKind.MODULE_FAILED, group.selected().packageName(),
                        "Could not read dependencies: " + e.getMessage());
                continue;
            }
            dependencyKeys.put(namespace, keys);

            for (NamespaceKey key : keys) {
                if (key.name().equals(namespace)) {
                    continue;
                }
                ModuleGroup existing = groups.get(key.name());
                if (existing != null) {
                    if (existing.selected() != null && !existing.selected().version().equals(key.version())) {
                        log.debug("{} requires {}, keeping {}", group.selected().packageName(),
                                key.packageName(), existing.selected().packageName());
                    }
                    continue;
                }
                Optional<ModuleFile> found = candidates.stream()
                        .filter(m -> m.namespace().equals(key.name()) && m.version().equals(key.version()))
                        .findFirst();
                if (found.isPresent()) {
                    groups.put(key.name(), ModuleGroup.grouped(key.name(), List.of(found.get())).resolve(found.get()));
                    queue.add(key.name());
                } else {
                    groups.put(key.name(), new ModuleGroup(key.name(), List.of(), ModuleState.FAILED, null));
                    failed.add(key.packageName());
                    report(DiagnosticKind.MODULE_FAILED, key.packageName(),
                            "Dependency of " + group.selected().packageName() + " not found");
                }
            }
        }

        propagateFailures(groups, dependencyKeys, failed);

        List<ModuleFile> loadOrder = topologicalOrder(groups, dependencyKeys);
        log.info("Load plan: {} modules, {} conflicting, {} failed",
                loadOrder.size(), groups.values().stream().filter(ModuleGroup::hasConflict).count(), failed.size());
        return new LoadPlan(loadOrder, new LinkedHashMap<>(groups), new ArrayList<>(failed));
    }

    private static List<ModuleFile> candidates(List<ModuleFile> available, Set<String> ignore) {
        Map<String, ModuleFile> byPackage = new LinkedHashMap<>();
        for (ModuleFile module : available) {
            if (ignore.contains(module.packageName())) {
                log.debug("Ignoring {}", module.packageName());
                continue;
            }
            ModuleFile previous = byPackage.putIfAbsent(module.packageName(), module);
            if (previous != null) {
                log.debug("{} shadowed by {}", module.path(), previous.path());
            }
        }
        return new ArrayList<>(byPackage.values());
    }

    private ModuleGroup decide(ModuleGroup group, List<ModulePattern> patterns) {
        if (group.modules().size() == 1) {
            return group.resolve(group.modules().get(0));
        }
        Optional<ModuleFile> winner = switch (policy) {
            case NONE -> Optional.empty();
            case HIGHEST_VERSION -> group.modules().stream()
                    .max(Comparator.comparing(ModuleFile::libraryVersion));
            case EXPLICIT_PREFIX -> explicitlyRequested(group, patterns);
        };
        if (winner.isPresent()) {
            log.debug("{}: selected {} by {}", group.namespace(), winner.get().packageName(), policy);
            return group.resolve(winner.get());
        }
        report(DiagnosticKind.MODULE_CONFLICT, group.namespace(),
                "Several versions found: " + group.modules().stream().map(ModuleFile::packageName).toList());
        return group.conflicting();
    }

    private static Optional<ModuleFile> explicitlyRequested(ModuleGroup group, List<ModulePattern> patterns) {
        Set<String> prefixes = new LinkedHashSet<>();
        patterns.forEach(p -> p.explicitVersionFor(group.namespace()).ifPresent(prefixes::add));
        if (prefixes.isEmpty()) {
            return Optional.empty();
        }
        List<ModuleFile> matching = group.modules().stream()
                .filter(m -> prefixes.stream().anyMatch(prefix -> m.libraryVersion().matchesPrefix(prefix)))
                .toList();
        return matching.stream().max(Comparator.comparing(ModuleFile::libraryVersion));
    }

    /**
     * A module whose dependency is not resolved fails too, until nothing changes.
     */
    private void propagateFailures(Map<String, ModuleGroup> groups, Map<String, List<NamespaceKey>> dependencyKeys,
                                   Set<String> failed) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (ModuleGroup group : new ArrayList<>(groups.values())) {
                if (group.state() != ModuleState.RESOLVED) {
                    continue;
                }
                for (NamespaceKey key : dependencyKeys.getOrDefault(group.namespace(), List.of())) {
                    ModuleGroup dependency = groups.get(key.name());
                    if (dependency == null || dependency.state() == ModuleState.RESOLVED) {
                        continue;
                    }
                    String packageName = group.selected().packageName();
                    groups.put(group.namespace(), group.failed());
                    failed.add(packageName);
                    report(DiagnosticKind.MODULE_FAILED, packageName,
                            "Dependency " + key.packageName() + " is " + dependency.state().name().toLowerCase());
                    changed = true;
                    break;
                }
            }
        }
    }

    /**
     * Kahn's algorithm over resolved groups, alphabetical among ready modules.
     */
    private static List<ModuleFile> topologicalOrder(Map<String, ModuleGroup> groups,
                                                     Map<String, List<NamespaceKey>> dependencyKeys) {
        Map<String, Set<String>> edges = new TreeMap<>();
        for (ModuleGroup group : groups.values()) {
            if (group.state() != ModuleState.RESOLVED) {
                continue;
            }
            Set<String> deps = new TreeSet<>();
            for (NamespaceKey key : dependencyKeys.getOrDefault(group.namespace(), List.of())) {
                if (!key.name().equals(group.namespace())) {
                    deps.add(key.name());
                }
            }
            edges.put(group.namespace(), deps);
        }

        Map<String, Integer> pending = new HashMap<>();
        Map<String, Set<String>> dependents = new HashMap<>();
        edges.forEach((namespace, deps) -> {
            pending.put(namespace, deps.size());
            deps.forEach(d -> dependents.computeIfAbsent(d, k -> new TreeSet<>()).add(namespace));
        });

        TreeSet<String> ready = new TreeSet<>();
        pending.forEach((namespace, count) -> {
            if (count == 0) {
                ready.add(namespace);
            }
        });

        List<ModuleFile> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String next = ready.pollFirst();
            order.add(groups.get(next).selected());
            for (String dependent : dependents.getOrDefault(next, Set.of())) {
                int remaining = pending.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < edges.size()) {
            throw new ModuleCycleException(findCycle(edges));
        }
        return order;
    }

    private static List<String> findCycle(Map<String, Set<String>> edges) {
        Set<String> visited = new HashSet<>();
        for (String start : edges.keySet()) {
            List<String> cycle = findCycleFrom(start, edges, visited, new LinkedHashSet<>(), new ArrayList<>());
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        return List.copyOf(edges.keySet());
    }

    private static List<String> findCycleFrom(String current, Map<String, Set<String>> edges, Set<String> visited,
                                              Set<String> inStack, List<String> path) {
        if (inStack.contains(current)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(current), path.size()));
            cycle.add(current);
            return cycle;
        }
        if (!visited.add(current)) {
            return List.of();
        }
        inStack.add(current);
        path.add(current);
        for (String dep : edges.getOrDefault(current, Set.of())) {
            List<String> cycle = findCycleFrom(dep, edges, visited, inStack, path);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        inStack.remove(current);
        return List.of();
    }

    private void report(DiagnosticKind kind, String subject, String message) {
        sink.report(Diagnostic.builder(kind)
                .namespace(subject)
                .subject(subject)
                .message(message)
                .build());
    }
}
