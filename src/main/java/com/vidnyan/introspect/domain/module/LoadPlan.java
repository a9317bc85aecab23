package com.vidnyan.introspect.domain.module;

import java.util.List;
import java.util.Map;

/**
 * Outcome of module loading.
 *
 * @param loadOrder modules to load, dependencies first
 * @param groups    every group by namespace, in final state
 * @param failed    requested patterns or dependencies that could not be satisfied
 */
public record LoadPlan(List<ModuleFile> loadOrder, Map<String, ModuleGroup> groups, List<String> failed) {

    public LoadPlan {
        loadOrder = List.copyOf(loadOrder);
        groups = Map.copyOf(groups);
        failed = List.copyOf(failed);
    }

    public List<ModuleGroup> conflicting() {
        return groups.values().stream()
                .filter(g -> g.state() == ModuleState.CONFLICTING)
                .sorted((a, b) -> a.namespace().compareTo(b.namespace()))
                .toList();
    }

    public List<ModuleGroup> inState(ModuleState state) {
        return groups.values().stream()
                .filter(g -> g.state() == state)
                .sorted((a, b) -> a.namespace().compareTo(b.namespace()))
                .toList();
    }
}
