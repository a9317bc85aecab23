package com.vidnyan.introspect.domain.patch;

import com.vidnyan.introspect.domain.IntrospectionException;

/**
 * A patch hook could not apply, typically because a declaration it targets is missing.
 */
public class PatchException extends IntrospectionException {

    public PatchException(String message) {
        super(message);
    }

    public PatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
