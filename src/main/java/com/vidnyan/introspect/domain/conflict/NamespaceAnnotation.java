package com.vidnyan.introspect.domain.conflict;

import com.vidnyan.introspect.domain.model.Namespace;

import java.util.List;

public record NamespaceAnnotation(Namespace annotated, List<ConflictRecord> records) {

    public NamespaceAnnotation {
        records = List.copyOf(records);
    }
}
