package com.vidnyan.introspect.domain.diagnostic;

/**
 * Kinds of diagnostics emitted while building the model.
 */
public enum DiagnosticKind {
    UNRESOLVED_REFERENCE(Severity.WARN),   // reference fell back to any
    SCOPED_OVER_GLOBAL(Severity.INFO),     // nested declaration preferred over a global one
    CONFLICT(Severity.INFO),               // classified member conflict
    OMITTED_MEMBER(Severity.INFO),         // member dropped by conflict resolution
    DUPLICATE_DECLARATION(Severity.WARN),  // raw tree declared a name twice
    PATCH_SKIPPED(Severity.WARN),          // patch hook could not apply
    MODULE_CONFLICT(Severity.WARN),        // several versions without disambiguation
    MODULE_FAILED(Severity.ERROR),         // module or dependency not resolvable
    READ_FAILED(Severity.ERROR);           // raw element tree unreadable

    private final Severity defaultSeverity;

    DiagnosticKind(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    public enum Severity {
        ERROR,
        WARN,
        INFO
    }
}
