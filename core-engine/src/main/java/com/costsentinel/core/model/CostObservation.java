package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One day of spend: the total daily cost plus its per-service breakdown.
 *
 * <p>
 * Instances are immutable. The service breakdown is expected to sum to
 * roughly {@link #getDailyCost()}, but this is not enforced.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CostObservation {

    private final LocalDate date;
    private final double dailyCost;
    private final Map<String, Double> serviceCosts;

    /**
     * @param date         calendar day; must not be {@code null}
     * @param dailyCost    total spend for the day; must be finite and {@code >= 0}
     * @param serviceCosts spend per service, may be {@code null} (treated as empty)
     * @throws NullPointerException     if {@code date}, a service name or a service
     *                                  cost is {@code null}
     * @throws IllegalArgumentException if {@code dailyCost} is negative or not finite
     */
    @JsonCreator
    public CostObservation(@JsonProperty("date") LocalDate date,
                           @JsonProperty("dailyCost") double dailyCost,
                           @JsonProperty("serviceCosts") Map<String, Double> serviceCosts) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        if (!Double.isFinite(dailyCost) || dailyCost < 0) {
            throw new IllegalArgumentException(
                    "dailyCost must be a finite, non-negative number for " + date + ", got: " + dailyCost);
        }
        this.dailyCost = dailyCost;

        Map<String, Double> copy = new LinkedHashMap<>();
        if (serviceCosts != null) {
            serviceCosts.forEach((service, cost) -> copy.put(
                    Objects.requireNonNull(service, "service name must not be null"),
                    Objects.requireNonNull(cost, "cost of service '" + service + "' must not be null")));
        }
        this.serviceCosts = Collections.unmodifiableMap(copy);
    }

    /**
     * Observation without a service breakdown.
     *
     * @param date      calendar day
     * @param dailyCost total spend for the day
     * @return new observation
     */
    public static CostObservation of(LocalDate date, double dailyCost) {
        return new CostObservation(date, dailyCost, Map.of());
    }

    public LocalDate getDate() {
        return date;
    }

    public double getDailyCost() {
        return dailyCost;
    }

    /**
     * @return unmodifiable service-to-cost map
     */
    public Map<String, Double> getServiceCosts() {
        return serviceCosts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CostObservation that))
            return false;
        return Double.compare(dailyCost, that.dailyCost) == 0
                && date.equals(that.date)
                && serviceCosts.equals(that.serviceCosts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, dailyCost, serviceCosts);
    }

    @Override
    public String toString() {
        return "CostObservation{" +
                "date=" + date +
                ", dailyCost=" + dailyCost +
                ", serviceCosts=" + serviceCosts +
                '}';
    }
}
