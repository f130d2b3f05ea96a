package com.costsentinel.core.detection;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Per-run values shared by every detector: the evaluation timestamp stamped on
 * each anomaly and the evaluation window requested by the caller.
 *
 * @since 1.0.0
 */
public final class DetectionContext {

    private final Instant detectedAt;
    private final LocalDate windowStart;
    private final LocalDate windowEnd;

    /**
     * @param detectedAt  evaluation timestamp; must not be {@code null}
     * @param windowStart first day of the evaluation window; must not be {@code null}
     * @param windowEnd   last day of the evaluation window; must not be {@code null}
     * @throws IllegalArgumentException if {@code windowStart} is after {@code windowEnd}
     */
    public DetectionContext(Instant detectedAt, LocalDate windowStart, LocalDate windowEnd) {
        this.detectedAt = Objects.requireNonNull(detectedAt, "detectedAt must not be null");
        this.windowStart = Objects.requireNonNull(windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        if (windowStart.isAfter(windowEnd)) {
            throw new IllegalArgumentException(
                    "windowStart " + windowStart + " is after windowEnd " + windowEnd);
        }
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public LocalDate getWindowStart() {
        return windowStart;
    }

    public LocalDate getWindowEnd() {
        return windowEnd;
    }

    @Override
    public String toString() {
        return "DetectionContext{" +
                "detectedAt=" + detectedAt +
                ", window=" + windowStart + ".." + windowEnd +
                '}';
    }
}
