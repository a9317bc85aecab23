package com.vidnyan.introspect.domain.conflict;

import com.vidnyan.introspect.domain.model.BaseClass;

import java.util.List;

/**
 * Result of annotating one declaration: the rewritten declaration and what was found.
 */
public record ClassAnnotation(BaseClass annotated, List<ConflictRecord> records) {

    public ClassAnnotation {
        records = List.copyOf(records);
    }

    public boolean hasConflicts() {
        return !records.isEmpty();
    }
}
