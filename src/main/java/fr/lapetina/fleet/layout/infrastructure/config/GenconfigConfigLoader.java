package fr.lapetina.fleet.layout.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the application settings.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Loading from a stream
 */
public final class GenconfigConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(GenconfigConfigLoader.class);

    /** Settings resource used when no path is given. */
    public static final String DEFAULT_PATH = "genconfig.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public GenconfigConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(GenconfigConfig.class, loaderOptions));
    }

    public GenconfigConfigLoader() {
        this(DEFAULT_PATH);
    }

    /**
     * Loads settings from file or classpath.
     *
     * @return The loaded settings
     * @throws ConfigurationException if loading fails
     */
    public GenconfigConfig load() {
        GenconfigConfig config = loadFromPath();
        // Unknown service names are rejected at load time
        config.defaultImages();
        return config;
    }

    private GenconfigConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading settings from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Settings file not found: " + configPath);
    }

    private GenconfigConfig loadFromFile(Path path) {
        log.info("Loading settings from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load settings from: " + path, e);
        }
    }

    /**
     * Loads settings from an input stream.
     */
    public GenconfigConfig loadFromStream(InputStream inputStream) {
        GenconfigConfig config = parse(inputStream, "stream");
        config.defaultImages();
        return config;
    }

    private GenconfigConfig parse(InputStream inputStream, String source) {
        try {
            GenconfigConfig config = yaml.load(inputStream);
            // An empty document yields no object at all
            return config != null ? config : new GenconfigConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid settings in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Exception for settings errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
