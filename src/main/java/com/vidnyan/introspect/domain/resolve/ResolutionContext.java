package com.vidnyan.introspect.domain.resolve;

import com.vidnyan.introspect.domain.model.Namespace;

/**
 * Where a reference was encountered.
 *
 * @param namespace the namespace owning the reference
 * @param container enclosing class/interface/record name, null at namespace level
 * @param subject   human-readable element path used in diagnostics
 */
public record ResolutionContext(Namespace namespace, String container, String subject) {

    public static ResolutionContext of(Namespace namespace) {
        return new ResolutionContext(namespace, null, namespace.name());
    }

    public ResolutionContext withContainer(String container) {
        return new ResolutionContext(namespace, container, container);
    }

    public ResolutionContext withSubject(String subject) {
        return new ResolutionContext(namespace, container, subject);
    }
}
