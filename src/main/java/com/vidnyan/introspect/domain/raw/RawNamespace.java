package com.vidnyan.introspect.domain.raw;

import java.util.List;

/**
 * Raw element tree of one (namespace, version), as produced by the parsing collaborator.
 */
public record RawNamespace(
    String name,
    String version,
    List<RawInclude> includes,
    List<RawClass> classes,
    List<RawClass> interfaces,
    List<RawClass> records,
    List<RawEnum> enums,
    List<RawFunction> functions,
    List<RawFunction> callbacks,
    List<RawConstant> constants,
    List<RawAlias> aliases
) {

    public RawNamespace {
        includes = orEmpty(includes);
        classes = orEmpty(classes);
        interfaces = orEmpty(interfaces);
        records = orEmpty(records);
        enums = orEmpty(enums);
        functions = orEmpty(functions);
        callbacks = orEmpty(callbacks);
        constants = orEmpty(constants);
        aliases = orEmpty(aliases);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * Declared dependency on another namespace.
     */
    public record RawInclude(String name, String version) {}

    public record RawEnum(String name, String cType, List<String> members, boolean flags) {}

    public record RawConstant(String name, String cType, RawTypeRef type, String value) {}

    public record RawAlias(String name, String cType, RawTypeRef target) {}
}
