package com.vidnyan.introspect.domain.model;

public enum Direction {
    IN,
    OUT,
    INOUT;

    public boolean isOutput() {
        return this != IN;
    }
}
