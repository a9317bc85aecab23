package com.vidnyan.introspect.adapter.out.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.introspect.IntrospectProperties;
import com.vidnyan.introspect.application.port.in.BuildModelUseCase.BuildResult;
import com.vidnyan.introspect.application.port.in.BuildModelUseCase.BuildStats;
import com.vidnyan.introspect.config.IntrospectConfiguration;
import com.vidnyan.introspect.domain.conflict.ConflictKind;
import com.vidnyan.introspect.domain.conflict.ConflictRecord;
import com.vidnyan.introspect.domain.conflict.ConflictResolution;
import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.model.ClassMember.MemberKind;
import com.vidnyan.introspect.domain.module.ModuleFile;
import com.vidnyan.introspect.domain.module.ModuleGroup;
import com.vidnyan.introspect.domain.type.Identifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.vidnyan.introspect.domain.ModelFixtures.classOf;
import static com.vidnyan.introspect.domain.ModelFixtures.namespace;
import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest {

    @TempDir
    Path tempDir;

    private static BuildResult result() {
        ModuleGroup dup = ModuleGroup.grouped("Dup", List.of(
                        ModuleFile.fromPath(Path.of("Dup-1.0.json")).orElseThrow(),
                        ModuleFile.fromPath(Path.of("Dup-2.0.json")).orElseThrow()))
                .conflicting();
        ConflictRecord record = new ConflictRecord(new Identifier("Test", "Button"), "show", MemberKind.FUNCTION,
                ConflictKind.FUNCTION_NAME_CONFLICT, ConflictResolution.KEEP_WITH_NEVER_OVERLOAD,
                new Identifier("Test", "Widget"));
        Diagnostic diagnostic = Diagnostic.builder(DiagnosticKind.UNRESOLVED_REFERENCE)
                .namespace("Test-1.0")
                .subject("Button.priv")
                .message("Missing.Private not found")
                .attributes(Map.of("reference", "Missing.Private"))
                .build();
        return new BuildResult(
                List.of(namespace("Test", "1.0", classOf("Test", "Button").build())),
                List.of(dup),
                List.of("Missing-1.0"),
                List.of(diagnostic),
                List.of(record),
                new BuildStats(4, 1, 1, 1, 1, 12));
    }

    @Test
    void publish_ShouldWriteJsonReport() throws IOException {
        // Arrange
        ObjectMapper objectMapper = new IntrospectConfiguration().objectMapper();
        IntrospectProperties properties = new IntrospectProperties();
        Path output = tempDir.resolve("reports/model.json");
        properties.getReport().setOutput(output.toString());
        JsonReportWriter writer = new JsonReportWriter(objectMapper, properties);

        // Act
        writer.publish(result());

        // Assert
        assertTrue(Files.exists(output));
        JsonNode report = objectMapper.readTree(output.toFile());
        assertEquals("Test-1.0", report.get("namespaces").get(0).asText());
        assertEquals("Dup", report.get("conflicting").get(0).get("namespace").asText());
        assertEquals(2, report.get("conflicting").get(0).get("modules").size());
        assertEquals("Missing-1.0", report.get("failed").get(0).asText());
        assertEquals(4, report.get("stats").get("modulesDiscovered").asInt());

        JsonNode conflict = report.get("conflicts").get(0);
        assertEquals("Test.Button", conflict.get("owner").asText());
        assertEquals("FUNCTION_NAME_CONFLICT", conflict.get("kind").asText());
        assertEquals("Test.Widget", conflict.get("ancestor").asText());

        JsonNode diagnostic = report.get("diagnostics").get(0);
        assertEquals("WARN", diagnostic.get("severity").asText());
        assertEquals("Missing.Private", diagnostic.get("attributes").get("reference").asText());
    }

    @Test
    void toReport_ShouldKeepForcedConflictsWithoutAncestor() {
        BuildResult base = result();
        ConflictRecord forced = new ConflictRecord(new Identifier("Test", "Widget"), "connect", MemberKind.FUNCTION,
                ConflictKind.FUNCTION_NAME_CONFLICT, ConflictResolution.KEEP_WITH_NEVER_OVERLOAD, null);
        BuildResult result = new BuildResult(base.namespaces(), List.of(), List.of(), List.of(),
                List.of(forced), base.stats());

        JsonReportWriter.ModelReport report = JsonReportWriter.toReport(result);

        assertNull(report.conflicts().get(0).ancestor());
        assertTrue(report.conflicting().isEmpty());
    }
}
