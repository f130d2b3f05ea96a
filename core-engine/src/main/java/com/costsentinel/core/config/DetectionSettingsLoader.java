package com.costsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the detector tuning of a {@code CostAnomalyEngine} from YAML.
 *
 * <p>
 * A settings document only needs the keys it overrides: every section and
 * every key falls back to the built-in default, and an empty document is the
 * same as {@link DetectionSettings#defaults()}. Misspelt keys, duplicated keys
 * and out-of-range values are rejected here, before any detector is built.
 * </p>
 *
 * <p>
 * {@link #load()} prefers the file named by {@value #ENV_SETTINGS_PATH} and
 * otherwise reads the bundled {@value #DEFAULT_RESOURCE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionSettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionSettingsLoader.class);

    /** Environment variable naming an operator-supplied settings file. */
    public static final String ENV_SETTINGS_PATH = "ANOMALY_SETTINGS_PATH";

    /** Bundled settings carrying the default tuning of every detector. */
    public static final String DEFAULT_RESOURCE = "anomaly-detection.yml";

    private DetectionSettingsLoader() {
        // utility class; not instantiable
    }

    /**
     * Settings for this process: the file named by {@value #ENV_SETTINGS_PATH}
     * when it exists, the bundled {@value #DEFAULT_RESOURCE} otherwise.
     *
     * @return validated settings
     * @throws IllegalStateException if the chosen document is malformed or invalid
     */
    public static DetectionSettings load() {
        String override = System.getenv(ENV_SETTINGS_PATH);
        if (override != null && !override.isBlank()) {
            Path path = Path.of(override);
            if (Files.isRegularFile(path)) {
                return fromFile(path);
            }
            LOG.warn("{} points to missing file {}, using bundled detection settings",
                    ENV_SETTINGS_PATH, path);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path settings file; must not be {@code null}
     * @return validated settings
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read, is malformed or
     *                                  is invalid
     * @see #fromFile(Path)
     */
    public static DetectionSettings fromFile(String path) {
        return fromFile(Path.of(Objects.requireNonNull(path, "Settings file path must not be null")));
    }

    /**
     * @param path settings file; must not be {@code null}
     * @return validated settings
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read, is malformed or
     *                                  is invalid
     */
    public static DetectionSettings fromFile(Path path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return validated settings
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the resource is malformed or invalid
     */
    public static DetectionSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = DetectionSettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (in) {
            return read(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static DetectionSettings read(InputStream in, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectionSettings.class, options));

        DetectionSettings settings;
        try {
            settings = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed detection settings in " + source + ": " + e.getMessage(), e);
        }
        if (settings == null) {
            LOG.warn("Detection settings in {} are empty, using built-in tuning", source);
            settings = DetectionSettings.defaults();
        }
        settings.validate();

        LOG.info("Detection settings from {}: detectors={} parallelism={} baseSeed={}",
                source, settings.getDetectors(), settings.getParallelism(), settings.getBaseSeed());
        return settings;
    }
}
