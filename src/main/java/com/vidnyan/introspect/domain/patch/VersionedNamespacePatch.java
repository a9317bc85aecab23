package com.vidnyan.introspect.domain.patch;

import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.NamespaceKey;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Patch bound to one namespace name and a fixed set of versions.
 */
public abstract class VersionedNamespacePatch implements NamespacePatch {

    private final String namespace;
    private final Set<String> versions;

    protected VersionedNamespacePatch(String namespace, Set<String> versions) {
        this.namespace = namespace;
        this.versions = Set.copyOf(versions);
    }

    /**
     * Major versions {@code from..to}, inclusive, as version strings.
     */
    protected static Set<String> majorVersions(int from, int to) {
        return IntStream.rangeClosed(from, to)
                .mapToObj(String::valueOf)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean appliesTo(NamespaceKey key) {
        return namespace.equals(key.name()) && versions.contains(key.version());
    }

    @Override
    public String name() {
        return getClass().getSimpleName();
    }

    /**
     * The class, interface or record of that name.
     *
     * @throws PatchException when absent
     */
    protected BaseClass requireClass(Namespace ns, String className) {
        return ns.findClass(className)
                .orElseThrow(() -> new PatchException(name() + ": no declaration " + className + " in " + ns.key()));
    }
}
