package com.vidnyan.introspect.domain.diagnostic;

import java.util.Map;

/**
 * A single structured diagnostic entry.
 * Immutable value object.
 *
 * @param namespace package name the diagnostic belongs to, e.g. {@code Gpseq-1.0}
 * @param subject   the element concerned, e.g. {@code Result.vfunc_flat_map}
 */
public record Diagnostic(
    DiagnosticKind kind,
    DiagnosticKind.Severity severity,
    String namespace,
    String subject,
    String message,
    Map<String, Object> attributes
) {

    public Diagnostic {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Get attribute value.
     */
    @SuppressWarnings("unchecked")
    public <T> T getAttribute(String key, Class<T> type) {
        return (T) attributes.get(key);
    }

    public String format() {
        return String.format("[%s] %s %s: %s", kind, namespace, subject, message);
    }

    public static Builder builder(DiagnosticKind kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final DiagnosticKind kind;
        private DiagnosticKind.Severity severity;
        private String namespace;
        private String subject;
        private String message;
        private Map<String, Object> attributes = Map.of();

        private Builder(DiagnosticKind kind) {
            this.kind = kind;
            this.severity = kind.defaultSeverity();
        }

        public Builder severity(DiagnosticKind.Severity sev) { this.severity = sev; return this; }
        public Builder namespace(String ns) { this.namespace = ns; return this; }
        public Builder subject(String subj) { this.subject = subj; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder attributes(Map<String, Object> attrs) { this.attributes = attrs; return this; }

        public Diagnostic build() {
            return new Diagnostic(kind, severity, namespace, subject, message, attributes);
        }
    }
}
