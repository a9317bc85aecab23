package com.vidnyan.introspect.application.port.in;

import com.vidnyan.introspect.domain.conflict.ConflictRecord;
import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.NamespaceRegistry;
import com.vidnyan.introspect.domain.module.ModuleGroup;
import com.vidnyan.introspect.domain.module.VersionPolicy;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Primary use case: build the annotated introspection model for a set of modules.
 * This is the hand-off point to the rendering stage.
 */
public interface BuildModelUseCase {

    /**
     * Select, read, patch, resolve and annotate the requested modules.
     * @param request modules and search locations
     * @return load-ordered namespaces plus everything reported on the way
     * @throws com.vidnyan.introspect.domain.module.ModuleCycleException when the selected modules form a cycle
     */
    BuildResult build(BuildRequest request);

    /**
     * Build request parameters.
     */
    record BuildRequest(
        List<String> modules,        // patterns: *, Family-*, Name-1.*, Name-Version
        Set<String> ignore,          // package names excluded from discovery
        List<Path> searchPaths,
        VersionPolicy versionPolicy
    ) {
        public BuildRequest {
            modules = List.copyOf(modules);
            ignore = ignore == null ? Set.of() : Set.copyOf(ignore);
            searchPaths = List.copyOf(searchPaths);
            versionPolicy = versionPolicy == null ? VersionPolicy.NONE : versionPolicy;
        }

        public static BuildRequest forModules(List<String> modules, Path searchPath) {
            return new BuildRequest(modules, Set.of(), List.of(searchPath), VersionPolicy.NONE);
        }
    }

    /**
     * Build result.
     */
    record BuildResult(
        List<Namespace> namespaces,
        List<ModuleGroup> conflicting,
        List<String> failed,
        List<Diagnostic> diagnostics,
        List<ConflictRecord> records,
        BuildStats stats
    ) {
        public NamespaceRegistry registry() {
            return NamespaceRegistry.of(namespaces);
        }

        public Optional<Namespace> findNamespace(String name) {
            return namespaces.stream().filter(n -> n.name().equals(name)).findFirst();
        }

        public List<Diagnostic> diagnosticsOfKind(DiagnosticKind kind) {
            return diagnostics.stream()
                    .filter(d -> d.kind() == kind)
                    .toList();
        }

        public boolean hasErrors() {
            return diagnostics.stream()
                    .anyMatch(d -> d.severity() == DiagnosticKind.Severity.ERROR);
        }
    }

    /**
     * Build statistics.
     */
    record BuildStats(
        int modulesDiscovered,
        int namespacesLoaded,
        int classesAnnotated,
        int conflicts,
        int unresolvedReferences,
        long totalDurationMs
    ) {}
}
