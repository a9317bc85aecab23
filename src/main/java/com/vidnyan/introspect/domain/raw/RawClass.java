package com.vidnyan.introspect.domain.raw;

import java.util.List;

/**
 * Class, interface or record element.
 *
 * @param parent     raw super type reference (classes and records), may be null
 * @param interfaces implemented interfaces, or the prerequisites of an interface
 */
public record RawClass(
    String name,
    String cType,
    String parent,
    List<String> interfaces,
    List<RawFunction> constructors,
    List<RawFunction> methods,
    List<RawFunction> staticMethods,
    List<RawFunction> virtualMethods,
    List<RawVariable> properties,
    List<RawVariable> fields,
    List<RawFunction> callbacks
) {

    public RawClass {
        interfaces = orEmpty(interfaces);
        constructors = orEmpty(constructors);
        methods = orEmpty(methods);
        staticMethods = orEmpty(staticMethods);
        virtualMethods = orEmpty(virtualMethods);
        properties = orEmpty(properties);
        fields = orEmpty(fields);
        callbacks = orEmpty(callbacks);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
