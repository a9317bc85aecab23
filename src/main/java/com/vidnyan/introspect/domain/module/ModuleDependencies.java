package com.vidnyan.introspect.domain.module;

import com.vidnyan.introspect.domain.model.NamespaceKey;

import java.util.List;

/**
 * Reads the namespaces a module declares as dependencies.
 * May throw {@link com.vidnyan.introspect.domain.raw.ElementTreeReadException}.
 */
@FunctionalInterface
public interface ModuleDependencies {

    List<NamespaceKey> dependenciesOf(ModuleFile module);
}
