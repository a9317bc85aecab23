package com.vidnyan.introspect.domain.raw;

/**
 * @param direction {@code in}, {@code out} or {@code inout}; null means {@code in}
 */
public record RawParameter(String name, RawTypeRef type, String direction, boolean varArgs) {

    public static RawParameter in(String name, RawTypeRef type) {
        return new RawParameter(name, type, "in", false);
    }

    public static RawParameter out(String name, RawTypeRef type) {
        return new RawParameter(name, type, "out", false);
    }
}
