package com.vidnyan.introspect.domain.patch;

import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticSink;
import com.vidnyan.introspect.domain.model.Namespace;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Applies the registered patches to a namespace, each at most once.
 * A failing patch is skipped with a diagnostic and the namespace continues unpatched by it.
 */
@Slf4j
public class PatchRunner {

    private final List<NamespacePatch> patches;
    private final DiagnosticSink sink;

    public PatchRunner(List<NamespacePatch> patches, DiagnosticSink sink) {
        this.patches = List.copyOf(patches);
        this.sink = sink;
    }

    public Namespace apply(Namespace namespace) {
        Namespace current = namespace;
        for (NamespacePatch patch : patches) {
            if (!patch.appliesTo(current.key())) {
                continue;
            }
            try {
                current = patch.apply(current);
                log.debug("Applied patch {} to {}", patch.name(), current.key());
            } catch (RuntimeException e) {
                log.warn("Patch {} skipped for {}: {}", patch.name(), current.key(), e.getMessage());
                sink.report(Diagnostic.builder(DiagnosticKind.PATCH_SKIPPED)
                        .namespace(current.key().packageName())
                        .subject(patch.name())
                        .message(String.valueOf(e.getMessage()))
                        .attributes(Map.of("exception", e.getClass().getSimpleName()))
                        .build());
            }
        }
        return current;
    }

    public List<NamespacePatch> patches() {
        return patches;
    }
}
