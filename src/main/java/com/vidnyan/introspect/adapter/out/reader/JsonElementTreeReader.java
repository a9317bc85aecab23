package com.vidnyan.introspect.adapter.out.reader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.introspect.application.port.out.ElementTreeReader;
import com.vidnyan.introspect.domain.module.ModuleFile;
import com.vidnyan.introspect.domain.raw.ElementTreeReadException;
import com.vidnyan.introspect.domain.raw.RawNamespace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Reads raw element trees from JSON documents.
 * Name and version default to the file name and must agree with it when present.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonElementTreeReader implements ElementTreeReader {

    private final ObjectMapper objectMapper;

    @Override
    public RawNamespace read(ModuleFile module) {
        RawNamespace raw;
        try {
            raw = objectMapper.readValue(module.path().toFile(), RawNamespace.class);
        } catch (IOException e) {
            throw new ElementTreeReadException(module.path(), e);
        }
        if (raw == null) {
            throw new ElementTreeReadException(module.path(), "empty document");
        }
        if (raw.name() != null && !raw.name().equals(module.namespace())) {
            throw new ElementTreeReadException(module.path(),
                    "declares namespace " + raw.name() + ", expected " + module.namespace());
        }
        if (raw.version() != null && !raw.version().equals(module.version())) {
            throw new ElementTreeReadException(module.path(),
                    "declares version " + raw.version() + ", expected " + module.version());
        }

        for (RawNamespace.RawInclude include : raw.includes()) {
            if (isBlank(include.name()) || isBlank(include.version())) {
                throw new ElementTreeReadException(module.path(), "include without name or version");
            }
        }

        log.debug("Read {}: {} classes, {} interfaces, {} records", module.packageName(),
                raw.classes().size(), raw.interfaces().size(), raw.records().size());
        return new RawNamespace(module.namespace(), module.version(), raw.includes(), raw.classes(),
                raw.interfaces(), raw.records(), raw.enums(), raw.functions(), raw.callbacks(),
                raw.constants(), raw.aliases());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
