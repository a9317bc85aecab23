package com.vidnyan.introspect.application.port.out;

import com.vidnyan.introspect.domain.module.ModuleFile;
import com.vidnyan.introspect.domain.raw.ElementTreeReadException;
import com.vidnyan.introspect.domain.raw.RawNamespace;

/**
 * Port for reading the raw element tree of one module.
 * Implemented by adapters over whatever format the parsing collaborator emits.
 */
public interface ElementTreeReader {

    RawNamespace read(ModuleFile module) throws ElementTreeReadException;
}
