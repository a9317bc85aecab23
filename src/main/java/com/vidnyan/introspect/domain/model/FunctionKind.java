package com.vidnyan.introspect.domain.model;

public enum FunctionKind {
    CONSTRUCTOR,
    REGULAR,
    STATIC,
    VIRTUAL
}
