package com.vidnyan.introspect.domain.module;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LibraryVersionTest {

    @Test
    void numericSegments_ShouldCompareNumerically() {
        assertTrue(LibraryVersion.of("10.0").compareTo(LibraryVersion.of("9.0")) > 0);
        assertTrue(LibraryVersion.of("2.10").compareTo(LibraryVersion.of("2.9")) > 0);
    }

    @Test
    void missingSegments_ShouldCountAsZero() {
        assertEquals(0, LibraryVersion.of("3").compareTo(LibraryVersion.of("3.0")));
    }

    @Test
    void releases_ShouldSortAbovePreReleaseTags() {
        assertTrue(LibraryVersion.of("1.0").compareTo(LibraryVersion.of("1.beta")) > 0);
    }

    @Test
    void matchesPrefix_ShouldRespectSegmentBoundaries() {
        LibraryVersion version = LibraryVersion.of("3.24");

        assertTrue(version.matchesPrefix("3"));
        assertTrue(version.matchesPrefix("3.24"));
        assertFalse(version.matchesPrefix("3.2"));
    }

    @Test
    void fromPath_ShouldSplitAtLastDash() {
        ModuleFile module = ModuleFile.fromPath(Path.of("girs", "Gtk-Source-5.json")).orElseThrow();

        assertEquals("Gtk-Source", module.namespace());
        assertEquals("5", module.version());
        assertEquals("Gtk-Source-5", module.packageName());
    }

    @Test
    void fromPath_ShouldRejectOtherNames() {
        assertTrue(ModuleFile.fromPath(Path.of("Gtk-4.0.gir")).isEmpty());
        assertTrue(ModuleFile.fromPath(Path.of("Gtk.json")).isEmpty());
        assertTrue(ModuleFile.fromPath(Path.of("Gtk-.json")).isEmpty());
    }
}
