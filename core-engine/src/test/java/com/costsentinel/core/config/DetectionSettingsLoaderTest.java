package com.costsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionSettingsLoader}.
 */
class DetectionSettingsLoaderTest {

    @Test
    @DisplayName("Should load the bundled defaults from classpath")
    void shouldLoadBundledDefaults() {
        DetectionSettings settings = DetectionSettingsLoader.fromClasspath(DetectionSettingsLoader.DEFAULT_RESOURCE);

        assertThat(settings.getDetectors()).containsExactly("isolation", "density", "forecast", "seasonal");
        assertThat(settings.getParallelism()).isEqualTo(4);
        assertThat(settings.getIsolation().getNumTrees()).isEqualTo(100);
        assertThat(settings.getForecast().getConfidenceQuantile()).isEqualTo(1.96);
        assertThat(settings.getSeasonal().getPeriod()).isEqualTo(7);
        assertThat(settings.getConsolidation().getMaxConfidence()).isEqualTo(0.99);
    }

    @Test
    @DisplayName("Should overlay test settings on defaults")
    void shouldLoadTestSettings() {
        DetectionSettings settings = DetectionSettingsLoader.fromClasspath("test-detection.yml");

        assertThat(settings.getDetectors()).containsExactly("isolation", "statistical");
        assertThat(settings.getParallelism()).isEqualTo(2);
        assertThat(settings.getBaseSeed()).isEqualTo(42L);
        assertThat(settings.getIsolation().getNumTrees()).isEqualTo(50);
        // omitted keys keep their defaults
        assertThat(settings.getIsolation().getScoreThreshold()).isEqualTo(0.6);
        assertThat(settings.getStatistical().getDeviationFactor()).isEqualTo(3.0);
        assertThat(settings.getDensity().getMinPoints()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> DetectionSettingsLoader.fromClasspath("invalid-detection.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("validation failed")
                .hasMessageContaining("Unknown detector type: 'prophet'")
                .hasMessageContaining("parallelism must be > 0")
                .hasMessageContaining("isolation.scoreThreshold");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> DetectionSettingsLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when settings file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> DetectionSettingsLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Settings file not found");
    }

    @Test
    @DisplayName("Should load settings from a file")
    void shouldLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("detection.yml");
        Files.writeString(file, String.join("\n",
                "detectors: [forecast]",
                "forecast:",
                "  windowSize: 14",
                "  minObservations: 15",
                ""));

        DetectionSettings settings = DetectionSettingsLoader.fromFile(file.toString());

        assertThat(settings.getDetectors()).containsExactly("forecast");
        assertThat(settings.getForecast().getWindowSize()).isEqualTo(14);
        assertThat(settings.getForecast().getMinObservations()).isEqualTo(15);
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        DetectionSettings settings = DetectionSettingsLoader.fromFile(file.toString());

        assertThat(settings.getDetectors()).isEqualTo(DetectionSettings.defaults().getDetectors());
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("duplicate.yml");
        Files.writeString(file, "parallelism: 2\nparallelism: 3\n");

        assertThatThrownBy(() -> DetectionSettingsLoader.fromFile(file))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed detection settings in " + file)
                .hasMessageContaining("parallelism");
    }

    @Test
    @DisplayName("Should reject a misspelt key instead of silently keeping the default")
    void shouldRejectUnknownKeys(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("typo.yml");
        Files.writeString(file, "isolation:\n  numTress: 10\n");

        assertThatThrownBy(() -> DetectionSettingsLoader.fromFile(file))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed detection settings")
                .hasMessageContaining("numTress");
    }

    @Test
    @DisplayName("Should accept the defaults and reject an empty detector list")
    void shouldValidateDefaults() {
        DetectionSettings settings = DetectionSettings.defaults();
        settings.validate();

        settings.setDetectors(List.of());

        assertThatThrownBy(settings::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("At least one detector");
    }
}
