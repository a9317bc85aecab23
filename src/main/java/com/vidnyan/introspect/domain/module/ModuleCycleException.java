package com.vidnyan.introspect.domain.module;

import com.vidnyan.introspect.domain.IntrospectionException;

import java.util.List;

/**
 * The selected modules depend on each other in a cycle; no load order exists.
 */
public class ModuleCycleException extends IntrospectionException {

    private final List<String> cycle;

    public ModuleCycleException(List<String> cycle) {
        super("Circular module dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
