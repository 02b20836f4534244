package org.fungrim.lite.transpiler;

import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Render settings")
class RenderSettingsTest {

    @Test
    @DisplayName("The bundled properties match the defaults")
    void testBundledSettings() {
        // WHEN: We load the default classpath location
        RenderSettings settings = RenderSettings.load();

        // THEN: It agrees with the built-in defaults
        assertEquals(RenderSettings.defaults(), settings);
    }

    @Test
    @DisplayName("Keys missing from a file keep their defaults")
    void testPartialOverride() {
        // GIVEN: A properties file that only sets the entry and image prefixes
        // WHEN: We load it from the classpath
        RenderSettings settings = RenderSettings.load("classpath:settings/custom.properties");

        // THEN: Set keys are overridden and the rest keep their defaults
        assertEquals("/entries/", settings.entryDir());
        assertEquals("https://cdn.example.org/img/", settings.imageDir());
        assertEquals("../../symbol/", settings.symbolDir());
        assertEquals("140px", settings.thumbnailWidth());
    }

    @Test
    @DisplayName("A missing location yields the defaults")
    void testMissingLocation() {
        // WHEN: Neither the classpath resource nor the file exists
        RenderSettings fromClasspath = RenderSettings.load("classpath:no/such/file.properties");
        RenderSettings fromPath = RenderSettings.load("/no/such/dir/formula-lite.properties");

        // THEN: Both fall back to the defaults
        assertEquals(RenderSettings.defaults(), fromClasspath);
        assertEquals(RenderSettings.defaults(), fromPath);
    }

    @Test
    @DisplayName("Files are read from plain paths and file URIs")
    void testFileLocations(@TempDir Path dir) throws IOException {
        // GIVEN: A settings file on disk
        Path file = dir.resolve("render.properties");
        Files.writeString(file, "render.thumbnail-width=200px\n");

        // WHEN: We load it by path and by URI
        RenderSettings byPath = RenderSettings.load(file.toString());
        RenderSettings byUri = RenderSettings.load(file.toUri().toString());

        // THEN: Both see the override
        assertEquals("200px", byPath.thumbnailWidth());
        assertEquals("200px", byUri.thumbnailWidth());
    }

    @Test
    @DisplayName("Settings can be taken from an in-memory configuration")
    void testFromConfiguration() {
        // GIVEN: A configuration holding only the symbol prefix
        BaseConfiguration config = new BaseConfiguration();
        config.setProperty("render.symbol-dir", "/symbols/");

        // WHEN: We read settings from it
        RenderSettings settings = RenderSettings.from(config);

        // THEN: The symbol prefix is taken, the entry prefix defaults
        assertEquals("/symbols/", settings.symbolDir());
        assertEquals("../../entry/", settings.entryDir());
    }
}
