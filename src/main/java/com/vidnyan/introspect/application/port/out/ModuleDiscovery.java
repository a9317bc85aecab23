package com.vidnyan.introspect.application.port.out;

import com.vidnyan.introspect.domain.module.ModuleFile;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for finding raw element trees in search locations.
 */
public interface ModuleDiscovery {

    /**
     * Every module found, in search-location order.
     */
    List<ModuleFile> discover(List<Path> searchPaths);
}
