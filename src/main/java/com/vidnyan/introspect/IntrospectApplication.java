package com.vidnyan.introspect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Introspection model engine.
 *
 * Reads the element trees of native libraries and builds a resolved, conflict-annotated
 * type model for binding generation.
 */
@SpringBootApplication
public class IntrospectApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntrospectApplication.class, args);
    }
}
