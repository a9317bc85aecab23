package com.vidnyan.introspect.domain;

/**
 * Base of all failures raised while building the introspection model.
 */
public class IntrospectionException extends RuntimeException {

    public IntrospectionException(String message) {
        super(message);
    }

    public IntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
