package com.vidnyan.introspect.adapter.out.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.introspect.IntrospectProperties;
import com.vidnyan.introspect.application.port.in.BuildModelUseCase.BuildResult;
import com.vidnyan.introspect.application.port.in.BuildModelUseCase.BuildStats;
import com.vidnyan.introspect.application.port.out.ReportPublisher;
import com.vidnyan.introspect.domain.IntrospectionException;
import com.vidnyan.introspect.domain.conflict.ConflictRecord;
import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.module.ModuleFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes the diagnostic report of a build as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonReportWriter implements ReportPublisher {

    private final ObjectMapper objectMapper;
    private final IntrospectProperties properties;

    @Override
    public void publish(BuildResult result) {
        Path output = Path.of(properties.getReport().getOutput());
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(output.toFile(), toReport(result));
            log.info("Report written to {}", output);
        } catch (IOException e) {
            throw new IntrospectionException("Failed to write report " + output, e);
        }
    }

    static ModelReport toReport(BuildResult result) {
        return new ModelReport(
                result.namespaces().stream().map(n -> n.key().packageName()).toList(),
                result.conflicting().stream()
                        .map(g -> new ConflictingGroup(g.namespace(),
                                g.modules().stream().map(ModuleFile::packageName).toList()))
                        .toList(),
                result.failed(),
                result.stats(),
                result.records().stream().map(JsonReportWriter::toEntry).toList(),
                result.diagnostics().stream().map(JsonReportWriter::toEntry).toList()
        );
    }

    private static ConflictEntry toEntry(ConflictRecord record) {
        return new ConflictEntry(
                record.owner().qualifiedName(),
                record.member(),
                record.memberKind().name(),
                record.kind().name(),
                record.resolution().name(),
                record.ancestor() == null ? null : record.ancestor().qualifiedName());
    }

    private static DiagnosticEntry toEntry(Diagnostic diagnostic) {
        return new DiagnosticEntry(
                diagnostic.kind().name(),
                diagnostic.severity().name(),
                diagnostic.namespace(),
                diagnostic.subject(),
                diagnostic.message(),
                diagnostic.attributes());
    }

    // Report DTOs for JSON serialization
    record ModelReport(
        List<String> namespaces,
        List<ConflictingGroup> conflicting,
        List<String> failed,
        BuildStats stats,
        List<ConflictEntry> conflicts,
        List<DiagnosticEntry> diagnostics
    ) {}

    record ConflictingGroup(String namespace, List<String> modules) {}

    record ConflictEntry(String owner, String member, String memberKind, String kind, String resolution,
                         String ancestor) {}

    record DiagnosticEntry(String kind, String severity, String namespace, String subject, String message,
                           Map<String, Object> attributes) {}
}
