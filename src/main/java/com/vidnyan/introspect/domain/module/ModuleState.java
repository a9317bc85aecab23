package com.vidnyan.introspect.domain.module;

/**
 * Lifecycle of a module group: {@code DISCOVERED -> GROUPED -> RESOLVED | CONFLICTING | FAILED}.
 */
public enum ModuleState {
    DISCOVERED,
    GROUPED,
    RESOLVED,
    CONFLICTING,
    FAILED;

    public boolean isTerminal() {
        return this == RESOLVED || this == CONFLICTING || this == FAILED;
    }
}
