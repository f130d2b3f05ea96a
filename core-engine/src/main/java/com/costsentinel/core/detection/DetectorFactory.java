package com.costsentinel.core.detection;

import com.costsentinel.core.config.DetectionSettings;
import com.costsentinel.core.math.SeedStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link CostAnomalyDetector} instances from
 * {@link DetectionSettings}.
 *
 * <p>
 * This is the single point of extension when adding new detectors:
 * register the new type string here and create the corresponding detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class; not instantiable
    }

    /**
     * Create the detector registered under {@code type}.
     *
     * @param type     detector type, case-insensitive; must not be {@code null}
     * @param settings parameters of every detector; must not be {@code null}
     * @return an appropriate {@link CostAnomalyDetector} instance
     * @throws NullPointerException     if an argument is {@code null}
     * @throws IllegalArgumentException if the type is unknown
     */
    public static CostAnomalyDetector create(String type, DetectionSettings settings) {
        Objects.requireNonNull(type, "Detector type must not be null");
        Objects.requireNonNull(settings, "DetectionSettings must not be null");

        return switch (type.toLowerCase(Locale.ROOT)) {
            case "isolation" -> new IsolationOutlierDetector(settings.getIsolation(),
                    SeedStrategy.offset(settings.getBaseSeed()));
            case "density" -> new DensityOutlierDetector(settings.getDensity());
            case "forecast" -> new ForecastDeviationDetector(settings.getForecast());
            case "seasonal" -> new SeasonalResidualDetector(settings.getSeasonal());
            case "statistical" -> new StatisticalThresholdDetector(settings.getStatistical());
            default -> throw new IllegalArgumentException(
                    "Unknown detector type: '" + type
                            + "'. Supported types: " + String.join(", ", DetectionSettings.KNOWN_DETECTORS));
        };
    }

    /**
     * Create every detector enabled in {@code settings}, in configured order.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param settings detection settings; must not be {@code null}
     * @return unmodifiable list of detectors
     * @throws NullPointerException if {@code settings} is {@code null}
     */
    public static List<CostAnomalyDetector> createAll(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        LOG.info("Creating {} detector(s) from configuration", settings.getDetectors().size());
        List<CostAnomalyDetector> detectors = settings.getDetectors().stream()
                .map(type -> create(type, settings))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
