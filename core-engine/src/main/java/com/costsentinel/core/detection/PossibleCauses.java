package com.costsentinel.core.detection;

import com.costsentinel.core.model.CostObservation;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Human-readable hypotheses attached to an anomaly.
 *
 * @since 1.0.0
 */
final class PossibleCauses {

    /** Longest cause list attached to a single anomaly. */
    static final int MAX_CAUSES = 4;

    static final List<String> SEASONAL = List.of(
            "Deviation from normal weekly/monthly pattern",
            "Business activity spike or dip",
            "Seasonal event not matching historical patterns",
            "Calendar effects (holidays, weekends)");

    static final List<String> STATISTICAL = List.of(
            "Unexpected resource scaling",
            "New resource deployments",
            "Changed usage patterns",
            "Billing calculation changes");

    private PossibleCauses() {
    }

    /**
     * Causes for a day that deviates from {@code expectedCost}, most specific first.
     *
     * @param observation  the anomalous day
     * @param expectedCost cost the detector expected
     * @return at most {@value #MAX_CAUSES} causes
     */
    static List<String> forDeviation(CostObservation observation, double expectedCost) {
        List<String> causes = new ArrayList<>();
        double deviation = expectedCost == 0
                ? 0
                : Math.abs(observation.getDailyCost() - expectedCost) / expectedCost;

        if (deviation > 0.5) {
            causes.add("Major infrastructure change or deployment");
        }
        observation.getServiceCosts().entrySet().stream()
                .max(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .ifPresent(top -> causes.add("High usage in " + top.getKey() + " service"));
        if (observation.getDate().getDayOfWeek() == DayOfWeek.MONDAY) {
            causes.add("Monday spike (weekend catch-up workload)");
        }

        causes.add("Unexpected resource scaling event");
        causes.add("Change in usage patterns or workload");
        causes.add("New resource provisioning");
        causes.add("Pricing or billing rate changes");
        return List.copyOf(causes.subList(0, Math.min(MAX_CAUSES, causes.size())));
    }
}
