package com.vidnyan.introspect.adapter.in.cli;

import com.vidnyan.introspect.IntrospectProperties;
import com.vidnyan.introspect.application.port.in.BuildModelUseCase;
import com.vidnyan.introspect.application.port.in.BuildModelUseCase.BuildRequest;
import com.vidnyan.introspect.application.port.in.BuildModelUseCase.BuildResult;
import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.module.ModuleFile;
import com.vidnyan.introspect.domain.module.ModuleGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;

/**
 * CLI runner for a standalone model build.
 * Runs when introspect.run-on-startup is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelBuildCliRunner implements CommandLineRunner {

    private static final int MAX_LISTED_DIAGNOSTICS = 100;

    private final BuildModelUseCase buildModelUseCase;
    private final IntrospectProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        if (!properties.isRunOnStartup()) {
            log.info("Model build not requested. Set introspect.run-on-startup=true.");
            return;
        }

        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║           Introspection Model Engine                          ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Modules: {}", properties.getModules());
            log.info("╚══════════════════════════════════════════════════════════════╝");

            BuildResult result = buildModelUseCase.build(toRequest(properties));
            printResults(result);

            log.info("");
            log.info("Model build complete!");
        } finally {
            SpringApplication.exit(context, () -> 0);
        }
    }

    static BuildRequest toRequest(IntrospectProperties properties) {
        return new BuildRequest(
                properties.getModules(),
                new HashSet<>(properties.getIgnore()),
                properties.getSearchPaths().stream().map(Path::of).toList(),
                properties.getVersionPolicy());
    }

    private void printResults(BuildResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" BUILD RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Modules discovered:    {}", result.stats().modulesDiscovered());
        log.info(" Namespaces loaded:     {}", result.stats().namespacesLoaded());
        log.info(" Declarations:          {}", result.stats().classesAnnotated());
        log.info(" Conflicts:             {}", result.stats().conflicts());
        log.info(" Unresolved references: {}", result.stats().unresolvedReferences());
        log.info(" Duration:              {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");

        log.info("");
        log.info(" Available Modules:");
        for (Namespace namespace : result.namespaces()) {
            log.info(" - {} {}", namespace.key().packageName(), namespace.stats());
        }

        if (!result.conflicting().isEmpty()) {
            log.info("");
            log.info(" Conflicts:");
            for (ModuleGroup group : result.conflicting()) {
                log.info(" - {}", group.namespace());
                for (ModuleFile module : group.modules()) {
                    log.info("   - {} ({})", module.packageName(), module.path());
                }
            }
        }

        if (!result.failed().isEmpty()) {
            log.info("");
            log.info(" Dependencies not found:");
            result.failed().forEach(f -> log.info(" - {}", f));
        }

        List<Diagnostic> problems = result.diagnostics().stream()
                .filter(d -> d.severity() != DiagnosticKind.Severity.INFO)
                .toList();
        if (problems.isEmpty()) {
            return;
        }

        log.info("");
        log.info(" DIAGNOSTICS:");
        log.info("───────────────────────────────────────────────────────────────");
        int count = 0;
        for (Diagnostic d : problems) {
            count++;
            if (count > MAX_LISTED_DIAGNOSTICS) {
                log.info(" ... and {} more diagnostics", problems.size() - MAX_LISTED_DIAGNOSTICS);
                break;
            }
            log.info(" {} {}", d.severity(), d.format());
        }
    }
}
