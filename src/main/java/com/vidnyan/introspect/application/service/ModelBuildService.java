package com.vidnyan.introspect.application.service;

import com.vidnyan.introspect.IntrospectProperties;
import com.vidnyan.introspect.application.port.in.BuildModelUseCase;
import com.vidnyan.introspect.application.port.out.ElementTreeReader;
import com.vidnyan.introspect.application.port.out.ModuleDiscovery;
import com.vidnyan.introspect.application.port.out.ReportPublisher;
import com.vidnyan.introspect.domain.IntrospectionException;
import com.vidnyan.introspect.domain.conflict.ConflictDetector;
import com.vidnyan.introspect.domain.conflict.ConflictRecord;
import com.vidnyan.introspect.domain.conflict.NamespaceAnnotation;
import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticSink;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.NamespaceKey;
import com.vidnyan.introspect.domain.model.NamespaceRegistry;
import com.vidnyan.introspect.domain.module.LoadPlan;
import com.vidnyan.introspect.domain.module.ModuleFile;
import com.vidnyan.introspect.domain.module.ModuleLoader;
import com.vidnyan.introspect.domain.patch.NamespacePatch;
import com.vidnyan.introspect.domain.patch.PatchRunner;
import com.vidnyan.introspect.domain.raw.RawNamespace;
import com.vidnyan.introspect.domain.resolve.ModelResolver;
import com.vidnyan.introspect.domain.symbol.SymbolTableBuilder;
import com.vidnyan.introspect.domain.type.Identifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Main application service that orchestrates the model build.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelBuildService implements BuildModelUseCase {

    private static final Comparator<Diagnostic> DIAGNOSTIC_ORDER = Comparator
            .comparing(Diagnostic::namespace, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(Diagnostic::subject, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    private final ModuleDiscovery moduleDiscovery;
    private final ElementTreeReader elementTreeReader;
    private final ReportPublisher reportPublisher;
    private final List<NamespacePatch> patches;
    private final IntrospectProperties properties;

    @Override
    public BuildResult build(BuildRequest request) {
        Instant startTime = Instant.now();
        DiagnosticSink sink = new DiagnosticSink();
        log.info("Starting model build for: {}", request.modules());

        // Step 1: Discover and select modules
        log.info("Step 1: Selecting modules...");
        List<ModuleFile> available = moduleDiscovery.discover(request.searchPaths());
        Map<ModuleFile, RawNamespace> rawTrees = new ConcurrentHashMap<>();
        ModuleLoader loader = new ModuleLoader(request.versionPolicy(), sink);
        LoadPlan plan = loader.load(request.modules(), request.ignore(), available,
                module -> rawTrees.computeIfAbsent(module, elementTreeReader::read).includes().stream()
                        .map(include -> new NamespaceKey(include.name(), include.version()))
                        .toList());
        log.info("Selected {} of {} discovered modules", plan.loadOrder().size(), available.size());

        // Step 2: Build symbol tables and apply patches, one task per namespace
        log.info("Step 2: Building symbol tables...");
        Set<NamespaceKey> buildFailures = new LinkedHashSet<>();
        List<Namespace> namespaces = dropBrokenDependents(
                buildNamespaces(plan.loadOrder(), rawTrees, sink, buildFailures), buildFailures, sink);
        List<String> failed = new ArrayList<>(plan.failed());
        buildFailures.forEach(key -> failed.add(key.packageName()));

        // Step 3: Resolve references
        log.info("Step 3: Resolving type references...");
        NamespaceRegistry resolved = ModelResolver.resolveAll(NamespaceRegistry.of(namespaces), sink);

        // Step 4: Classify conflicts
        log.info("Step 4: Classifying member conflicts...");
        ConflictDetector detector = new ConflictDetector(
                universalBaseType(),
                new HashSet<>(properties.getConflicts().getReservedMethods()),
                sink);
        List<Namespace> annotated = new ArrayList<>();
        List<ConflictRecord> records = new ArrayList<>();
        int classCount = 0;
        for (Namespace namespace : resolved.namespaces()) {
            NamespaceAnnotation annotation = detector.annotateNamespace(resolved, namespace);
            annotated.add(annotation.annotated());
            records.addAll(annotation.records());
            classCount += namespace.classes().size();
        }
        log.info("Classified {} conflicts across {} declarations", records.size(), classCount);

        // Build result
        Duration totalDuration = Duration.between(startTime, Instant.now());
        List<Diagnostic> diagnostics = sink.diagnostics().stream().sorted(DIAGNOSTIC_ORDER).toList();
        BuildStats stats = new BuildStats(
                available.size(),
                annotated.size(),
                classCount,
                records.size(),
                (int) diagnostics.stream().filter(d -> d.kind() == DiagnosticKind.UNRESOLVED_REFERENCE).count(),
                totalDuration.toMillis()
        );
        BuildResult result = new BuildResult(annotated, plan.conflicting(), failed, diagnostics, records, stats);

        // Step 5: Publish report
        if (properties.getReport().isEnabled()) {
            log.info("Step 5: Publishing report...");
            try {
                reportPublisher.publish(result);
            } catch (IntrospectionException e) {
                log.error("Failed to publish report: {}", e.getMessage());
            }
        }

        log.info("Model build complete: {} namespaces, {} diagnostics in {}ms",
                annotated.size(), diagnostics.size(), stats.totalDurationMs());
        return result;
    }

    /**
     * Read, build and patch each module on the worker pool. The join of all futures is the
     * barrier before resolution; results keep load order.
     */
    private List<Namespace> buildNamespaces(List<ModuleFile> loadOrder, Map<ModuleFile, RawNamespace> rawTrees,
                                            DiagnosticSink sink, Set<NamespaceKey> failed) {
        SymbolTableBuilder builder = new SymbolTableBuilder(sink);
        PatchRunner patchRunner = new PatchRunner(patches, sink);
        Map<String, List<String>> known = properties.getConflicts().getKnown();

        List<Callable<Namespace>> tasks = loadOrder.stream()
                .map(module -> (Callable<Namespace>) () -> {
                    RawNamespace raw = rawTrees.computeIfAbsent(module, elementTreeReader::read);
                    Set<String> knownConflicts = Set.copyOf(known.getOrDefault(module.namespace(), List.of()));
                    return patchRunner.apply(builder.build(raw, knownConflicts));
                })
                .toList();

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()));
        try {
            List<Future<Namespace>> futures = executor.invokeAll(tasks);
            List<Namespace> namespaces = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    namespaces.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    ModuleFile module = loadOrder.get(i);
                    failed.add(module.key());
                    log.error("Failed to build {}: {}", module.packageName(), e.getCause().getMessage());
                    sink.report(Diagnostic.builder(DiagnosticKind.MODULE_FAILED)
                            .namespace(module.packageName())
                            .subject(module.packageName())
                            .message("Build failed: " + e.getCause().getMessage())
                            .build());
                }
            }
            return namespaces;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntrospectionException("Interrupted while building namespaces", e);
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Drops every namespace that depends, directly or through another dropped namespace, on a
     * module that failed to build. Load order is dependencies first, so one pass suffices.
     */
    private List<Namespace> dropBrokenDependents(List<Namespace> built, Set<NamespaceKey> failed,
                                                 DiagnosticSink sink) {
        Set<String> broken = new HashSet<>();
        failed.forEach(key -> broken.add(key.name()));
        List<Namespace> kept = new ArrayList<>();
        for (Namespace namespace : built) {
            Optional<NamespaceKey> brokenDependency = namespace.dependencies().stream()
                    .filter(key -> broken.contains(key.name()))
                    .findFirst();
            if (brokenDependency.isEmpty()) {
                kept.add(namespace);
                continue;
            }
            String packageName = namespace.key().packageName();
            log.warn("Dropping {}: dependency {} failed", packageName, brokenDependency.get().packageName());
            broken.add(namespace.name());
            failed.add(namespace.key());
            sink.report(Diagnostic.builder(DiagnosticKind.MODULE_FAILED)
                    .namespace(packageName)
                    .subject(packageName)
                    .message("Dependency " + brokenDependency.get().packageName() + " failed")
                    .build());
        }
        return kept;
    }

    private Identifier universalBaseType() {
        String configured = properties.getConflicts().getUniversalBaseType();
        int dot = configured.indexOf('.');
        if (dot <= 0) {
            throw new IntrospectionException("Universal base type must be qualified (Ns.Name): " + configured);
        }
        return new Identifier(configured.substring(0, dot), configured.substring(dot + 1));
    }
}
