package com.vidnyan.introspect.adapter.in.cli;

import com.vidnyan.introspect.IntrospectProperties;
import com.vidnyan.introspect.application.port.in.BuildModelUseCase.BuildRequest;
import com.vidnyan.introspect.domain.module.VersionPolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelBuildCliRunnerTest {

    @Test
    void toRequest_ShouldMapProperties() {
        // Arrange
        IntrospectProperties properties = new IntrospectProperties();
        properties.setModules(List.of("Gtk-4.0", "Gst*"));
        properties.setIgnore(List.of("Gtk-3.0"));
        properties.setSearchPaths(List.of("/usr/share/girs", "girs"));
        properties.setVersionPolicy(VersionPolicy.EXPLICIT_PREFIX);

        // Act
        BuildRequest request = ModelBuildCliRunner.toRequest(properties);

        // Assert
        assertEquals(List.of("Gtk-4.0", "Gst*"), request.modules());
        assertEquals(Set.of("Gtk-3.0"), request.ignore());
        assertEquals(List.of(Path.of("/usr/share/girs"), Path.of("girs")), request.searchPaths());
        assertEquals(VersionPolicy.EXPLICIT_PREFIX, request.versionPolicy());
    }
}
