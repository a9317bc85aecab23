package com.vidnyan.introspect.domain.raw;

import java.util.List;

/**
 * Function, method, virtual method, constructor or callback signature.
 */
public record RawFunction(String name, String cType, List<RawParameter> parameters, RawTypeRef returnType) {

    public RawFunction {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static RawFunction of(String name, RawTypeRef returnType, RawParameter... parameters) {
        return new RawFunction(name, null, List.of(parameters), returnType);
    }
}
