package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Outcome of the risk gate for one cycle.
 *
 * <p>{@code violations} names every breached hard limit; it is empty whenever
 * {@code approved} is true. A soft veto carries no hard violations but a
 * {@code softReason}.
 */
public record RiskVerdict(
    @JsonProperty("approved") boolean approved,
    @JsonProperty("violations") List<String> violations,
    @JsonProperty("adjustedWeights") Map<String, Double> adjustedWeights,
    @JsonProperty("maxAllowedChange") double maxAllowedChange,
    @JsonProperty("softReason") String softReason
) {
    public RiskVerdict {
        violations      = violations != null ? List.copyOf(violations) : List.of();
        adjustedWeights = adjustedWeights != null ? Map.copyOf(adjustedWeights) : Map.of();
        if (approved && !violations.isEmpty()) {
            throw new IllegalArgumentException("an approved verdict cannot carry violations");
        }
    }

    public static RiskVerdict holdPasses(double maxAllowedChange) {
        return new RiskVerdict(true, List.of(), Map.of(), maxAllowedChange, "hold action passes trivially");
    }

    public static RiskVerdict hardVeto(List<String> violations, double maxAllowedChange) {
        return new RiskVerdict(false, violations, Map.of(), maxAllowedChange, null);
    }

    public static RiskVerdict softVeto(String reason, double maxAllowedChange) {
        return new RiskVerdict(false, List.of(), Map.of(), maxAllowedChange, reason);
    }

    public static RiskVerdict approve(Map<String, Double> adjustedWeights, double maxAllowedChange, String note) {
        return new RiskVerdict(true, List.of(), adjustedWeights, maxAllowedChange, note);
    }

    @JsonIgnore
    public boolean isVeto() {
        return !approved;
    }
}
