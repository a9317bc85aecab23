package com.vidnyan.introspect.adapter.out.discovery;

import com.vidnyan.introspect.application.port.out.ModuleDiscovery;
import com.vidnyan.introspect.domain.IntrospectionException;
import com.vidnyan.introspect.domain.module.ModuleFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Scans search directories for {@code <Name>-<Version>.json} element trees.
 * Each directory is scanned flat; files not following the naming scheme are skipped.
 */
@Slf4j
@Component
public class FileSystemModuleDiscovery implements ModuleDiscovery {

    @Override
    public List<ModuleFile> discover(List<Path> searchPaths) {
        List<ModuleFile> modules = new ArrayList<>();

        for (Path directory : searchPaths) {
            if (!Files.isDirectory(directory)) {
                log.warn("Search path {} is not a directory, skipping", directory);
                continue;
            }
            try (Stream<Path> paths = Files.list(directory)) {
                paths.filter(Files::isRegularFile)
                     .sorted()
                     .map(ModuleFile::fromPath)
                     .flatMap(Optional::stream)
                     .forEach(modules::add);
            } catch (IOException e) {
                throw new IntrospectionException("Failed to scan " + directory, e);
            }
        }

        log.info("Discovered {} modules in {}", modules.size(), searchPaths);
        return modules;
    }
}
