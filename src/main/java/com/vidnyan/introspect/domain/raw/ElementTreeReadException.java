package com.vidnyan.introspect.domain.raw;

import com.vidnyan.introspect.domain.IntrospectionException;

import java.nio.file.Path;

/**
 * A raw element tree could not be read or parsed.
 */
public class ElementTreeReadException extends IntrospectionException {

    private final Path path;

    public ElementTreeReadException(Path path, Throwable cause) {
        super("Failed to read element tree " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public ElementTreeReadException(Path path, String message) {
        super("Invalid element tree " + path + ": " + message);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
