package com.costsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Top-level POJO for the anomaly-detection YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional and falls back to its default):
 * </p>
 *
 * <pre>
 * detectors: [isolation, density, forecast, seasonal]
 * parallelism: 4
 * baseSeed: 0
 * isolation:
 *   numTrees: 100
 *   scoreThreshold: 0.6
 * forecast:
 *   windowSize: 30
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings {

    /** Detector type names accepted in {@link #getDetectors()}. */
    public static final List<String> KNOWN_DETECTORS =
            List.of("isolation", "density", "forecast", "seasonal", "statistical");

    private List<String> detectors = new ArrayList<>(List.of("isolation", "density", "forecast", "seasonal"));

    /** Worker threads used to run detectors side by side. */
    private int parallelism = 4;

    /** Added to the tree index to seed each isolation tree. */
    private long baseSeed = 0L;

    private IsolationSettings isolation = new IsolationSettings();
    private DensitySettings density = new DensitySettings();
    private ForecastSettings forecast = new ForecastSettings();
    private SeasonalSettings seasonal = new SeasonalSettings();
    private StatisticalSettings statistical = new StatisticalSettings();
    private ConsolidationSettings consolidation = new ConsolidationSettings();

    /**
     * @return settings with every default value
     */
    public static DetectionSettings defaults() {
        return new DetectionSettings();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (detectors.isEmpty()) {
            errors.add("At least one detector must be enabled");
        }
        for (String detector : detectors) {
            if (detector == null || !KNOWN_DETECTORS.contains(detector.toLowerCase(Locale.ROOT))) {
                errors.add("Unknown detector type: '" + detector + "'. Supported: "
                        + String.join(", ", KNOWN_DETECTORS));
            }
        }
        if (parallelism <= 0) {
            errors.add("parallelism must be > 0");
        }

        isolation.validate(errors);
        density.validate(errors);
        forecast.validate(errors);
        seasonal.validate(errors);
        statistical.validate(errors);
        consolidation.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection settings validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    /**
     * @return unmodifiable list of enabled detector types, in execution order
     */
    public List<String> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    public void setDetectors(List<String> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public long getBaseSeed() {
        return baseSeed;
    }

    public void setBaseSeed(long baseSeed) {
        this.baseSeed = baseSeed;
    }

    public IsolationSettings getIsolation() {
        return isolation;
    }

    public void setIsolation(IsolationSettings isolation) {
        this.isolation = isolation != null ? isolation : new IsolationSettings();
    }

    public DensitySettings getDensity() {
        return density;
    }

    public void setDensity(DensitySettings density) {
        this.density = density != null ? density : new DensitySettings();
    }

    public ForecastSettings getForecast() {
        return forecast;
    }

    public void setForecast(ForecastSettings forecast) {
        this.forecast = forecast != null ? forecast : new ForecastSettings();
    }

    public SeasonalSettings getSeasonal() {
        return seasonal;
    }

    public void setSeasonal(SeasonalSettings seasonal) {
        this.seasonal = seasonal != null ? seasonal : new SeasonalSettings();
    }

    public StatisticalSettings getStatistical() {
        return statistical;
    }

    public void setStatistical(StatisticalSettings statistical) {
        this.statistical = statistical != null ? statistical : new StatisticalSettings();
    }

    public ConsolidationSettings getConsolidation() {
        return consolidation;
    }

    public void setConsolidation(ConsolidationSettings consolidation) {
        this.consolidation = consolidation != null ? consolidation : new ConsolidationSettings();
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "detectors=" + detectors +
                ", parallelism=" + parallelism +
                ", baseSeed=" + baseSeed +
                '}';
    }
}
