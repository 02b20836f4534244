package org.fungrim.lite.transpiler;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Link targets and layout constants used by the HTML renderers.
 *
 * Settings are read from a properties file through Commons Configuration.
 * Locations may be {@code classpath:name}, a {@code file:} URI or a plain
 * filesystem path.
 *
 * @param entryDir       Prefix of entry page links
 * @param symbolDir      Prefix of symbol page links
 * @param imageDir       Prefix of image asset paths
 * @param thumbnailWidth CSS width of image previews
 */
public record RenderSettings(String entryDir, String symbolDir, String imageDir, String thumbnailWidth) {

    private static final Logger LOG = LoggerFactory.getLogger(RenderSettings.class);

    public static final String DEFAULT_LOCATION = "classpath:formula-lite.properties";

    static final String ENTRY_DIR = "render.entry-dir";
    static final String SYMBOL_DIR = "render.symbol-dir";
    static final String IMAGE_DIR = "render.image-dir";
    static final String THUMBNAIL_WIDTH = "render.thumbnail-width";

    private static final RenderSettings DEFAULTS =
            new RenderSettings("../../entry/", "../../symbol/", "../../img/", "140px");

    public static RenderSettings defaults() {
        return DEFAULTS;
    }

    public static RenderSettings load() {
        return load(DEFAULT_LOCATION);
    }

    /**
     * Loads settings from a location. Keys absent from the file keep their defaults.
     *
     * @throws ConfigException if the location exists but cannot be read or parsed
     */
    public static RenderSettings load(String location) {
        if (location == null || location.isBlank()) {
            return load(DEFAULT_LOCATION);
        }
        String loc = location.trim();
        PropertiesConfiguration config;
        if (loc.startsWith("classpath:")) {
            config = readClasspath(loc.substring("classpath:".length()));
        } else if (loc.startsWith("file:")) {
            config = readFile(Paths.get(URI.create(loc)), loc);
        } else {
            config = readFile(Paths.get(loc), loc);
        }
        if (config == null) {
            LOG.warn("Settings not found at {}, using defaults", loc);
            return DEFAULTS;
        }
        RenderSettings settings = from(config);
        LOG.info("Loaded render settings from {}: {}", loc, settings);
        return settings;
    }

    /**
     * Reads settings from an already-populated configuration.
     */
    public static RenderSettings from(Configuration config) {
        return new RenderSettings(
                config.getString(ENTRY_DIR, DEFAULTS.entryDir),
                config.getString(SYMBOL_DIR, DEFAULTS.symbolDir),
                config.getString(IMAGE_DIR, DEFAULTS.imageDir),
                config.getString(THUMBNAIL_WIDTH, DEFAULTS.thumbnailWidth));
    }

    private static PropertiesConfiguration readClasspath(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RenderSettings.class.getClassLoader();
        }
        try (InputStream input = loader.getResourceAsStream(resource)) {
            if (input == null) {
                return null;
            }
            return read(new InputStreamReader(input, StandardCharsets.UTF_8));
        } catch (IOException | ConfigurationException e) {
            throw new ConfigException("Failed to read settings from classpath resource: " + resource, e);
        }
    }

    private static PropertiesConfiguration readFile(Path path, String location) {
        if (!Files.exists(path)) {
            return null;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException | ConfigurationException e) {
            throw new ConfigException("Failed to read settings from " + location, e);
        }
    }

    private static PropertiesConfiguration read(Reader reader) throws ConfigurationException, IOException {
        PropertiesConfiguration config = new PropertiesConfiguration();
        config.read(reader);
        return config;
    }
}
