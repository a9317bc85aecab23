package com.vidnyan.introspect.domain.conflict;

/**
 * Classification of an unsafe member override, ordered by severity.
 */
public enum ConflictKind {
    FIELD_NAME_CONFLICT(1),
    PROPERTY_NAME_CONFLICT(1),
    ACCESSOR_PROPERTY_CONFLICT(2),
    VFUNC_SIGNATURE_CONFLICT(3),
    FUNCTION_NAME_CONFLICT(4);

    private final int severity;

    ConflictKind(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    public boolean isMoreSevereThan(ConflictKind other) {
        return other == null || severity > other.severity;
    }

    /**
     * The more severe of two kinds; the first wins ties.
     */
    public static ConflictKind max(ConflictKind current, ConflictKind candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate == null) {
            return current;
        }
        return candidate.isMoreSevereThan(current) ? candidate : current;
    }
}
