package com.vidnyan.introspect.domain.diagnostic;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thread-safe collector for diagnostics of one run.
 * Each entry is also logged at a level matching its severity.
 */
@Slf4j
public class DiagnosticSink {

    private final List<Diagnostic> diagnostics = Collections.synchronizedList(new ArrayList<>());

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        switch (diagnostic.severity()) {
            case ERROR -> log.error(diagnostic.format());
            case WARN -> log.warn(diagnostic.format());
            case INFO -> log.debug(diagnostic.format());
        }
    }

    /**
     * Snapshot of everything reported so far, in report order.
     */
    public List<Diagnostic> diagnostics() {
        synchronized (diagnostics) {
            return List.copyOf(diagnostics);
        }
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return diagnostics().stream()
                .filter(d -> d.kind() == kind)
                .toList();
    }

    public long count(DiagnosticKind.Severity severity) {
        return diagnostics().stream()
                .filter(d -> d.severity() == severity)
                .count();
    }
}
