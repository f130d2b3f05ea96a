package com.costsentinel.core.engine;

import com.costsentinel.core.config.DetectionSettings;
import com.costsentinel.core.detection.AnomalyConsolidator;
import com.costsentinel.core.detection.CostAnomalyDetector;
import com.costsentinel.core.detection.DetectionContext;
import com.costsentinel.core.detection.DetectorFactory;
import com.costsentinel.core.model.CostAnomaly;
import com.costsentinel.core.model.CostObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Entry point of the detection engine.
 *
 * <p>
 * Each call validates the series, runs every configured detector as its own task
 * on a fixed worker pool, waits for all of them and consolidates the combined
 * findings. Detectors only read the shared series, so no locking is involved.
 * </p>
 *
 * <h3>Cancellation</h3>
 * <p>
 * The optional {@link BooleanSupplier} is checked before the detectors start,
 * after they have all finished and after consolidation. When it reports
 * {@code true} the run ends with a {@link CancellationException} and no partial
 * result. Interrupting the calling thread has the same effect.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * The engine owns its worker pool; {@link #close()} shuts it down.
 * </p>
 *
 * @since 1.0.0
 */
public final class CostAnomalyEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CostAnomalyEngine.class);

    private final List<CostAnomalyDetector> detectors;
    private final AnomalyConsolidator consolidator;
    private final Clock clock;
    private final ExecutorService executor;

    /**
     * Engine using the system UTC clock.
     *
     * @param settings detection settings; must not be {@code null}
     * @throws IllegalStateException if {@code settings} fails validation
     */
    public CostAnomalyEngine(DetectionSettings settings) {
        this(settings, Clock.systemUTC());
    }

    /**
     * @param settings detection settings, validated before any detector is built;
     *                 must not be {@code null}
     * @param clock    source of the evaluation timestamp; must not be {@code null}
     * @throws IllegalStateException if {@code settings} fails validation
     */
    public CostAnomalyEngine(DetectionSettings settings, Clock clock) {
        this(DetectorFactory.createAll(checked(settings)),
                new AnomalyConsolidator(settings.getConsolidation()),
                clock,
                settings.getParallelism());
    }

    /**
     * @param detectors    detectors to run; must not be {@code null}
     * @param consolidator merge stage; must not be {@code null}
     * @param clock        source of the evaluation timestamp; must not be {@code null}
     * @param parallelism  worker threads; must be {@code > 0}
     */
    public CostAnomalyEngine(List<CostAnomalyDetector> detectors, AnomalyConsolidator consolidator,
                             Clock clock, int parallelism) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
        this.consolidator = Objects.requireNonNull(consolidator, "consolidator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0, got: " + parallelism);
        }
        this.executor = Executors.newFixedThreadPool(parallelism, new DetectorThreadFactory());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Detect anomalies without external cancellation.
     *
     * @see #detectAnomalies(List, LocalDate, LocalDate, BooleanSupplier)
     */
    public List<CostAnomaly> detectAnomalies(List<CostObservation> observations,
                                             LocalDate windowStart, LocalDate windowEnd) {
        return detectAnomalies(observations, windowStart, windowEnd, () -> false);
    }

    /**
     * Run every detector over {@code observations} and consolidate the result.
     *
     * @param observations          strictly date-ordered daily observations; must
     *                              not be {@code null}
     * @param windowStart           first day of the evaluation window
     * @param windowEnd             last day of the evaluation window
     * @param cancellationRequested polled between stages; must not be {@code null}
     * @return one anomaly per anomalous date, highest confidence first; empty when
     *         no detector has enough data
     * @throws IllegalArgumentException   if the series contains {@code null} or is
     *                                     not strictly date-ordered, or the window is
     *                                     inverted
     * @throws CancellationException      if cancellation was requested or the
     *                                     calling thread was interrupted
     * @throws AnomalyDetectionException  if a detector fails
     */
    public List<CostAnomaly> detectAnomalies(List<CostObservation> observations,
                                             LocalDate windowStart, LocalDate windowEnd,
                                             BooleanSupplier cancellationRequested) {
        Objects.requireNonNull(observations, "observations must not be null");
        Objects.requireNonNull(cancellationRequested, "cancellationRequested must not be null");
        DetectionContext context = new DetectionContext(Instant.now(clock), windowStart, windowEnd);

        LOG.info("Starting anomaly detection for period {} to {} over {} observation(s)",
                windowStart, windowEnd, observations.size());

        List<CostObservation> series = validated(observations);
        if (series.isEmpty()) {
            return List.of();
        }

        checkCancelled(cancellationRequested, "before detection");
        List<CostAnomaly> findings = runDetectors(series, context);

        checkCancelled(cancellationRequested, "before consolidation");
        List<CostAnomaly> anomalies = consolidator.consolidate(findings);

        checkCancelled(cancellationRequested, "after consolidation");
        LOG.info("Detected {} anomalies using {} detector(s)", anomalies.size(), detectors.size());
        return anomalies;
    }

    /**
     * @return the detectors this engine runs, in order
     */
    public List<CostAnomalyDetector> getDetectors() {
        return detectors;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<CostAnomaly> runDetectors(List<CostObservation> series, DetectionContext context) {
        List<Future<List<CostAnomaly>>> futures = new ArrayList<>(detectors.size());
        for (CostAnomalyDetector detector : detectors) {
            futures.add(executor.submit(() -> detector.detect(series, context)));
        }

        List<CostAnomaly> findings = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                findings.addAll(futures.get(i).get());
            } catch (InterruptedException e) {
                cancelAll(futures);
                Thread.currentThread().interrupt();
                CancellationException cancelled = new CancellationException("Anomaly detection interrupted");
                cancelled.initCause(e);
                throw cancelled;
            } catch (ExecutionException e) {
                cancelAll(futures);
                throw new AnomalyDetectionException(
                        "Detector '" + detectors.get(i).getMethodName() + "' failed", e.getCause());
            }
        }
        return findings;
    }

    private static DetectionSettings checked(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        settings.validate();
        return settings;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private static void checkCancelled(BooleanSupplier cancellationRequested, String stage) {
        if (cancellationRequested.getAsBoolean()) {
            LOG.info("Anomaly detection cancelled {}", stage);
            throw new CancellationException("Anomaly detection cancelled " + stage);
        }
    }

    private static List<CostObservation> validated(List<CostObservation> observations) {
        List<CostObservation> series = new ArrayList<>(observations.size());
        LocalDate previous = null;
        for (int i = 0; i < observations.size(); i++) {
            CostObservation observation = observations.get(i);
            if (observation == null) {
                throw new IllegalArgumentException("Observation at index " + i + " is null");
            }
            if (previous != null && !observation.getDate().isAfter(previous)) {
                throw new IllegalArgumentException("Observations must be strictly date-ordered: "
                        + observation.getDate() + " at index " + i + " follows " + previous);
            }
            previous = observation.getDate();
            series.add(observation);
        }
        return List.copyOf(series);
    }

    /** Daemon threads named {@code cost-detector-N}. */
    private static final class DetectorThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "cost-detector-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
