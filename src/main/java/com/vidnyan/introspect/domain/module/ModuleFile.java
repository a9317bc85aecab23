package com.vidnyan.introspect.domain.module;

import com.vidnyan.introspect.domain.model.NamespaceKey;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One discovered raw element tree, named {@code <Namespace>-<Version>.json}.
 */
public record ModuleFile(String namespace, String version, Path path) {

    public static final String EXTENSION = ".json";

    public ModuleFile {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(version, "version");
    }

    /**
     * Parse a file name; empty when it does not follow the naming scheme.
     */
    public static Optional<ModuleFile> fromPath(Path path) {
        String fileName = path.getFileName().toString();
        if (!fileName.endsWith(EXTENSION)) {
            return Optional.empty();
        }
        String packageName = fileName.substring(0, fileName.length() - EXTENSION.length());
        int dash = packageName.lastIndexOf('-');
        if (dash <= 0 || dash == packageName.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new ModuleFile(packageName.substring(0, dash), packageName.substring(dash + 1), path));
    }

    public String packageName() {
        return namespace + "-" + version;
    }

    public NamespaceKey key() {
        return new NamespaceKey(namespace, version);
    }

    public LibraryVersion libraryVersion() {
        return LibraryVersion.of(version);
    }
}
