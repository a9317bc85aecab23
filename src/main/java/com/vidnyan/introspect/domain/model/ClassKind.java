package com.vidnyan.introspect.domain.model;

public enum ClassKind {
    CLASS,
    INTERFACE,
    RECORD
}
