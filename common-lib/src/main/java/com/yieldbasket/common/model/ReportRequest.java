package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Uniform input handed to every report producer. */
public record ReportRequest(
    @JsonProperty("snapshot") BasketSnapshot snapshot,
    @JsonProperty("calibrationHints") List<CalibrationHint> calibrationHints,
    @JsonProperty("triggerReason") TriggerReason triggerReason,
    @JsonProperty("traceId") String traceId
) {
    public ReportRequest {
        calibrationHints = calibrationHints != null ? List.copyOf(calibrationHints) : List.of();
    }

    /** Mean historical accuracy for one producer across the supplied hints, NaN if none scored it. */
    public double meanAccuracyOf(ProducerKind kind) {
        return calibrationHints.stream()
            .filter(h -> h.producerAccuracy().containsKey(kind))
            .mapToDouble(h -> h.producerAccuracy().get(kind))
            .average()
            .orElse(Double.NaN);
    }
}
