package com.vidnyan.introspect.adapter.out.reader;

import com.vidnyan.introspect.config.IntrospectConfiguration;
import com.vidnyan.introspect.domain.module.ModuleFile;
import com.vidnyan.introspect.domain.raw.ElementTreeReadException;
import com.vidnyan.introspect.domain.raw.RawClass;
import com.vidnyan.introspect.domain.raw.RawNamespace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonElementTreeReaderTest {

    @TempDir
    Path tempDir;

    private JsonElementTreeReader reader;

    @BeforeEach
    void setUp() {
        reader = new JsonElementTreeReader(new IntrospectConfiguration().objectMapper());
    }

    private ModuleFile write(String fileName, String json) throws IOException {
        Path path = Files.writeString(tempDir.resolve(fileName), json);
        return ModuleFile.fromPath(path).orElseThrow();
    }

    @Test
    void read_ShouldParseElementTree() throws IOException {
        // Arrange
        ModuleFile module = write("Gio-2.0.json", "{"
                + "\"includes\": [{\"name\": \"GObject\", \"version\": \"2.0\"}],"
                + "\"classes\": [{"
                + "  \"name\": \"Cancellable\","
                + "  \"parent\": \"GObject.Object\","
                + "  \"virtualMethods\": [{\"name\": \"cancelled\"}],"
                + "  \"properties\": [{\"name\": \"label\", \"type\": {\"name\": \"utf8\"}, \"writable\": false}]"
                + "}],"
                + "\"comment\": \"unknown members are ignored\""
                + "}");

        // Act
        RawNamespace raw = reader.read(module);

        // Assert
        assertEquals("Gio", raw.name());
        assertEquals("2.0", raw.version());
        assertEquals("GObject", raw.includes().get(0).name());
        RawClass cancellable = raw.classes().get(0);
        assertEquals("GObject.Object", cancellable.parent());
        assertEquals("cancelled", cancellable.virtualMethods().get(0).name());
        assertEquals(Boolean.FALSE, cancellable.properties().get(0).writable());
        assertTrue(raw.interfaces().isEmpty());
    }

    @Test
    void read_ShouldRejectMismatchedNamespace() throws IOException {
        ModuleFile module = write("Gio-2.0.json", "{ \"name\": \"Gtk\", \"version\": \"2.0\" }");

        ElementTreeReadException e = assertThrows(ElementTreeReadException.class, () -> reader.read(module));

        assertEquals(module.path(), e.getPath());
        assertTrue(e.getMessage().contains("Gtk"));
    }

    @Test
    void read_ShouldRejectMismatchedVersion() throws IOException {
        ModuleFile module = write("Gio-2.0.json", "{ \"version\": \"3.0\" }");

        assertThrows(ElementTreeReadException.class, () -> reader.read(module));
    }

    @Test
    void read_ShouldRejectIncludeWithoutVersion() throws IOException {
        // Arrange
        ModuleFile module = write("Gtk-4.0.json", "{ \"includes\": [{ \"name\": \"Gio\" }] }");

        // Act
        ElementTreeReadException e = assertThrows(ElementTreeReadException.class, () -> reader.read(module));

        // Assert
        assertEquals(module.path(), e.getPath());
        assertTrue(e.getMessage().contains("include"));
    }

    @Test
    void read_ShouldWrapMalformedJson() throws IOException {
        ModuleFile module = write("Gio-2.0.json", "{ \"classes\": [");

        ElementTreeReadException e = assertThrows(ElementTreeReadException.class, () -> reader.read(module));

        assertNotNull(e.getCause());
    }
}
