package com.vidnyan.introspect.domain.module;

import java.util.List;
import java.util.Objects;

/**
 * All discovered versions of one namespace, and which of them (if any) takes part in the run.
 *
 * @param selected the module chosen for loading; null unless {@link ModuleState#RESOLVED}
 */
public record ModuleGroup(String namespace, List<ModuleFile> modules, ModuleState state, ModuleFile selected) {

    public ModuleGroup {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(state, "state");
        modules = List.copyOf(modules);
    }

    public static ModuleGroup grouped(String namespace, List<ModuleFile> modules) {
        return new ModuleGroup(namespace, modules, ModuleState.GROUPED, null);
    }

    public ModuleGroup resolve(ModuleFile module) {
        return new ModuleGroup(namespace, modules, ModuleState.RESOLVED, module);
    }

    public ModuleGroup conflicting() {
        return new ModuleGroup(namespace, modules, ModuleState.CONFLICTING, null);
    }

    public ModuleGroup failed() {
        return new ModuleGroup(namespace, modules, ModuleState.FAILED, null);
    }

    /**
     * More than one version remains and none was chosen.
     */
    public boolean hasConflict() {
        return modules.size() > 1 && selected == null && state != ModuleState.FAILED;
    }
}
