package com.vidnyan.introspect.domain.raw;

/**
 * Property or field.
 */
public record RawVariable(String name, RawTypeRef type, Boolean readable, Boolean writable) {

    public static RawVariable of(String name, RawTypeRef type) {
        return new RawVariable(name, type, true, true);
    }
}
