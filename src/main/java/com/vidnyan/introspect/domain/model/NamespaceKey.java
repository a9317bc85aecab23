package com.vidnyan.introspect.domain.model;

import java.util.Objects;

/**
 * Identity of a symbol table: library namespace plus version.
 */
public record NamespaceKey(String name, String version) implements Comparable<NamespaceKey> {

    public NamespaceKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
    }

    /**
     * Parse a package name such as {@code Gtk-4.0}. The version follows the last dash.
     */
    public static NamespaceKey parse(String packageName) {
        int dash = packageName.lastIndexOf('-');
        if (dash <= 0 || dash == packageName.length() - 1) {
            throw new IllegalArgumentException("Not a package name (expected Name-Version): " + packageName);
        }
        return new NamespaceKey(packageName.substring(0, dash), packageName.substring(dash + 1));
    }

    /**
     * Package name, e.g. {@code Gtk-4.0}.
     */
    public String packageName() {
        return name + "-" + version;
    }

    @Override
    public int compareTo(NamespaceKey other) {
        int byName = name.compareTo(other.name);
        return byName != 0 ? byName : version.compareTo(other.version);
    }

    @Override
    public String toString() {
        return packageName();
    }
}
